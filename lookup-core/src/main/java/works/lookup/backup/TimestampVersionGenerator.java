package works.lookup.backup;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import org.jetbrains.annotations.Nullable;

/**
 * Versions of the form {@code <epoch seconds>.<microseconds>}, taken from a {@link Clock}.
 * <p>
 * If the clock hasn't moved past {@code latest} (same microsecond, or a clock that went backward),
 * the result is {@code latest} plus one microsecond instead.
 */
public final class TimestampVersionGenerator implements VersionGenerator {
	private static final BigDecimal ONE_MICROSECOND = new BigDecimal("0.000001");

	private final Clock clock;

	public TimestampVersionGenerator(Clock clock) {
		this.clock = clock;
	}

	@Override
	public String next(@Nullable String latest) {
		Instant now = clock.instant();
		BigDecimal candidate = BigDecimal.valueOf(now.getEpochSecond())
			.add(BigDecimal.valueOf(now.getNano() / 1_000, 6));
		if (latest != null) {
			Optional<BigDecimal> latestNumber = VersionOrder.asNumber(latest);
			if (latestNumber.isPresent() && candidate.compareTo(latestNumber.get()) <= 0) {
				candidate = latestNumber.get().add(ONE_MICROSECOND);
			}
		}
		return candidate.setScale(Math.max(6, candidate.scale())).toPlainString();
	}
}
