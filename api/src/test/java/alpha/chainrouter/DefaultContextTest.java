package alpha.chainrouter;

import org.junit.jupiter.api.Test;

import static alpha.chainrouter.HttpConstants.Method.GET;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests of {@link DefaultContext}.
 */
final class DefaultContextTest {
    @Test
    void initialState() {
        var ctx = new DefaultContext(GET, "/a");
        assertThat(ctx.method()).isEqualTo("GET");
        assertThat(ctx.path()).isEqualTo("/a");
        assertThat(ctx.status()).isEqualTo(404);
        assertThat(ctx.isUnhandled()).isTrue();
        assertThat(ctx.redirectTarget()).isEmpty();
    }
    
    @Test
    void redirectAndStatus() {
        var ctx = new DefaultContext(GET, "/old");
        ctx.redirect("/new");
        ctx.status(301);
        assertThat(ctx.isUnhandled()).isFalse();
        assertThat(ctx.redirectTarget()).hasValue("/new");
        assertThat(ctx).hasToString(
            "DefaultContext{method=GET, path=/old, status=301, redirect=/new}");
    }
    
    @Test
    void nullArguments_NPE() {
        assertThatThrownBy(() -> new DefaultContext(null, "/"))
            .isExactlyInstanceOf(NullPointerException.class);
        assertThatThrownBy(() -> new DefaultContext(GET, null))
            .isExactlyInstanceOf(NullPointerException.class);
        assertThatThrownBy(() -> new DefaultContext(GET, "/").redirect(null))
            .isExactlyInstanceOf(NullPointerException.class);
    }
}
