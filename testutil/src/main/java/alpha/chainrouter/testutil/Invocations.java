package alpha.chainrouter.testutil;

import alpha.chainrouter.handler.Endpoint;
import alpha.chainrouter.handler.Middleware;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static java.util.Objects.requireNonNull;

/**
 * Creates named handlers that record their invocation.<p>
 * 
 * The recorded names are used to assert the order in which a chain ran its
 * handlers.
 * 
 * <pre>{@code
 *   var calls = new Invocations();
 *   Chains.compose(calls.step("a"), calls.stop("b"), calls.step("c"))
 *         .accept(ctx);
 *   assertThat(calls.names()).containsExactly("a", "b");
 * }</pre>
 */
public final class Invocations
{
    private final List<String> names = new CopyOnWriteArrayList<>();
    
    /**
     * Returns a middleware that records the given name and then proceeds.
     * 
     * @param name to record
     * @return a middleware
     */
    public Middleware step(String name) {
        requireNonNull(name);
        return (ctx, chain) -> {
            names.add(name);
            chain.proceed();
        };
    }
    
    /**
     * Returns a middleware that records the given name and does not proceed.
     * 
     * @param name to record
     * @return a middleware
     */
    public Middleware stop(String name) {
        requireNonNull(name);
        return (ctx, chain) -> names.add(name);
    }
    
    /**
     * Returns a middleware that records the given name and then proceeds
     * twice.
     * 
     * @param name to record
     * @return a middleware
     */
    public Middleware repeat(String name) {
        requireNonNull(name);
        return (ctx, chain) -> {
            names.add(name);
            chain.proceed();
            chain.proceed();
        };
    }
    
    /**
     * Returns an endpoint that records the given name.
     * 
     * @param name to record
     * @return an endpoint
     */
    public Endpoint endpoint(String name) {
        requireNonNull(name);
        return ctx -> names.add(name);
    }
    
    /**
     * Returns all recorded names, in invocation order.
     * 
     * @return all recorded names (unmodifiable)
     */
    public List<String> names() {
        return List.copyOf(names);
    }
    
    /**
     * Returns the number of recorded invocations.
     * 
     * @return the number of recorded invocations
     */
    public int count() {
        return names.size();
    }
}
