package alpha.chainrouter.handler;

import alpha.chainrouter.Context;
import alpha.chainrouter.DefaultContext;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import static alpha.chainrouter.HttpConstants.Method.GET;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertSame;

/**
 * Unit tests of {@link Chains}.
 */
final class ChainsTest {
    private final List<String> calls = new ArrayList<>();
    private final Context ctx = new DefaultContext(GET, "/");
    
    private Middleware step(String name) {
        return (ctx, chain) -> {
            calls.add(name);
            chain.proceed();
        };
    }
    
    private Middleware stop(String name) {
        return (ctx, chain) -> calls.add(name);
    }
    
    @Test
    void empty_isNoop() throws Exception {
        var ctx = new DefaultContext(GET, "/");
        Chains.compose().accept(ctx);
        assertThat(ctx.status()).isEqualTo(404);
        assertThat(ctx.redirectTarget()).isEmpty();
    }
    
    @Test
    void single_proceedReturns() throws Exception {
        Chains.compose(step("a")).accept(ctx);
        assertThat(calls).containsExactly("a");
    }
    
    @Test
    void runsInOrder() throws Exception {
        Chains.compose(step("a"), step("b"), step("c")).accept(ctx);
        assertThat(calls).containsExactly("a", "b", "c");
    }
    
    @Test
    void notProceeding_shortCircuits() throws Exception {
        Chains.compose(step("a"), stop("b"), step("c")).accept(ctx);
        assertThat(calls).containsExactly("a", "b");
    }
    
    @Test
    void codeAfterProceed_runsAfterDownstream() throws Exception {
        Middleware around = (ctx, chain) -> {
            calls.add("before");
            chain.proceed();
            calls.add("after");
        };
        Chains.compose(around, step("inner")).accept(ctx);
        assertThat(calls).containsExactly("before", "inner", "after");
    }
    
    @Test
    void proceedTwice_rerunsRemainder() throws Exception {
        Middleware twice = (ctx, chain) -> {
            calls.add("twice");
            chain.proceed();
            chain.proceed();
        };
        Chains.compose(step("a"), twice, step("b"), step("c")).accept(ctx);
        assertThat(calls).containsExactly("a", "twice", "b", "c", "b", "c");
    }
    
    @Test
    void eachInvocation_startsOver() throws Exception {
        var chain = Chains.compose(step("a"), step("b"));
        chain.accept(ctx);
        chain.accept(ctx);
        assertThat(calls).containsExactly("a", "b", "a", "b");
    }
    
    @Test
    void composedList_isSnapshot() throws Exception {
        var list = new ArrayList<Middleware>();
        list.add(step("a"));
        list.add(step("b"));
        var chain = Chains.compose(list);
        list.add(step("c"));
        chain.accept(ctx);
        assertThat(calls).containsExactly("a", "b");
    }
    
    @Test
    void exception_propagates() {
        var boom = new IOException("boom");
        var chain = Chains.compose(step("a"), (ctx, ch) -> { throw boom; }, step("c"));
        assertThatThrownBy(() -> chain.accept(ctx)).isSameAs(boom);
        assertThat(calls).containsExactly("a");
    }
    
    @Test
    void end_doesNothing() throws Exception {
        Chains.end().proceed();
        assertSame(Chains.end(), Chains.end());
    }
    
    @Test
    void nullHandler_NPE() {
        assertThatThrownBy(() -> Chains.compose(step("a"), null))
            .isExactlyInstanceOf(NullPointerException.class);
    }
}
