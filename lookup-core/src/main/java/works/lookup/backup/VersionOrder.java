package works.lookup.backup;

import java.math.BigDecimal;
import java.util.Comparator;
import java.util.Optional;

/**
 * Orders backup versions.
 * <p>
 * Versions written by {@link TimestampVersionGenerator} and by earlier releases are decimal
 * epoch timestamps of varying precision ({@code "1523456789.12"}, {@code "1523456789.123456"}),
 * which don't sort correctly as text, so decimal versions compare numerically.
 * Anything that isn't decimal sorts first and compares as text,
 * so freshly minted timestamps always come after it.
 */
public final class VersionOrder implements Comparator<String> {
	public static final VersionOrder INSTANCE = new VersionOrder();

	private VersionOrder() { }

	@Override
	public int compare(String a, String b) {
		Optional<BigDecimal> aNumber = asNumber(a);
		Optional<BigDecimal> bNumber = asNumber(b);
		if (aNumber.isPresent() && bNumber.isPresent()) {
			int result = aNumber.get().compareTo(bNumber.get());
			return result != 0 ? result : a.compareTo(b);
		} else if (aNumber.isPresent()) {
			return 1;
		} else if (bNumber.isPresent()) {
			return -1;
		} else {
			return a.compareTo(b);
		}
	}

	static Optional<BigDecimal> asNumber(String version) {
		if (version.isEmpty() || !version.chars().allMatch(c -> c == '.' || Character.isDigit(c))) {
			return Optional.empty();
		}
		try {
			return Optional.of(new BigDecimal(version));
		} catch (NumberFormatException e) {
			return Optional.empty();
		}
	}
}
