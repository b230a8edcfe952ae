package works.lookup.logging;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

class MdcScopeTest {

	@AfterEach
	void clearMdc() {
		MDC.clear();
	}

	@Test
	void scope_setsAndClears() {
		try (var __ = MdcScope.forLookup("test.csv", "search", "nobody")) {
			assertEquals("test.csv", MDC.get(MdcKeys.LOOKUP_NAME));
			assertEquals("search", MDC.get(MdcKeys.NAMESPACE));
			assertEquals("nobody", MDC.get(MdcKeys.OWNER));
		}
		assertNull(MDC.get(MdcKeys.LOOKUP_NAME));
		assertNull(MDC.get(MdcKeys.NAMESPACE));
		assertNull(MDC.get(MdcKeys.OWNER));
	}

	@Test
	void nestedScopes_restoreOuterValues() {
		try (var outer = MdcScope.forLookup("outer.csv", "search", "alice")) {
			try (var inner = MdcScope.forLookup("inner.csv", "lookup_test", "nobody")) {
				assertEquals("inner.csv", MDC.get(MdcKeys.LOOKUP_NAME));
			}
			assertEquals("outer.csv", MDC.get(MdcKeys.LOOKUP_NAME));
			assertEquals("search", MDC.get(MdcKeys.NAMESPACE));
			assertEquals("alice", MDC.get(MdcKeys.OWNER));
		}
	}

	@Test
	void nullValue_removesKeyForTheScope() {
		MDC.put(MdcKeys.OWNER, "bob");
		try (var __ = MdcScope.forLookup("test.csv", "search", null)) {
			assertNull(MDC.get(MdcKeys.OWNER));
		}
		assertEquals("bob", MDC.get(MdcKeys.OWNER));
	}
}
