package alpha.chainrouter.route;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests of {@link RouteKey}.
 */
final class RouteKeyTest {
    @Test
    void concatenates() {
        assertThat(RouteKey.of("GET", "/api", "/users"))
            .hasToString("GET+/api/users")
            .isEqualTo(new RouteKey("GET+/api/users"));
    }
    
    @Test
    void emptyPrefix() {
        assertThat(RouteKey.of("POST", "", "/x").value()).isEqualTo("POST+/x");
    }
    
    @Test
    void noSeparatorIsInserted_betweenPrefixAndPath() {
        // Same key, different split
        assertThat(RouteKey.of("GET", "/a", "/b"))
            .isEqualTo(RouteKey.of("GET", "", "/a/b"))
            .isEqualTo(RouteKey.of("GET", "/a/", "b"));
    }
    
    @Test
    void caseSensitive() {
        assertThat(RouteKey.of("get", "", "/x"))
            .isNotEqualTo(RouteKey.of("GET", "", "/x"));
    }
    
    @Test
    void null_NPE() {
        assertThatThrownBy(() -> RouteKey.of("GET", null, "/"))
            .isExactlyInstanceOf(NullPointerException.class);
    }
}
