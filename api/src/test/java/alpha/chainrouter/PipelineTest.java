package alpha.chainrouter;

import alpha.chainrouter.handler.Endpoint;
import alpha.chainrouter.route.Router;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static alpha.chainrouter.HttpConstants.Method.GET;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests of {@link Pipeline}.
 */
final class PipelineTest {
    private final List<String> calls = new ArrayList<>();
    
    @Test
    void empty_isNoop() throws Exception {
        var ctx = new DefaultContext(GET, "/");
        new Pipeline().handler().accept(ctx);
        assertThat(ctx.isUnhandled()).isTrue();
    }
    
    @Test
    void stagesRunInOrder() throws Exception {
        var p = new Pipeline()
                .use((ctx, chain) -> { calls.add("m"); chain.proceed(); })
                .use((Endpoint) ctx -> calls.add("e1"))
                .use((Endpoint) ctx -> calls.add("e2"));
        assertThat(p.size()).isEqualTo(3);
        p.handler().accept(new DefaultContext(GET, "/"));
        assertThat(calls).containsExactly("m", "e1", "e2");
    }
    
    @Test
    void mount_usesRoutesOfRouter() throws Exception {
        Endpoint routes = ctx -> calls.add("router");
        var router = mock(Router.class);
        when(router.routes()).thenReturn(routes);
        
        new Pipeline().mount(router)
                      .use((Endpoint) ctx -> calls.add("after"))
                      .handler()
                      .accept(new DefaultContext(GET, "/"));
        
        verify(router).routes();
        assertThat(calls).containsExactly("router", "after");
    }
    
    @Test
    void handler_isSnapshot() throws Exception {
        var p = new Pipeline().use((Endpoint) ctx -> calls.add("1"));
        var h = p.handler();
        p.use((Endpoint) ctx -> calls.add("2"));
        h.accept(new DefaultContext(GET, "/"));
        assertThat(calls).containsExactly("1");
    }
}
