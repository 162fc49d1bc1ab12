package alpha.chainrouter.handler;

import alpha.chainrouter.Chain;
import alpha.chainrouter.Context;

import java.util.List;

/**
 * Composes middleware into an endpoint.
 */
public final class Chains
{
    private static final Endpoint NOOP = ctxIgnored -> {};
    
    private Chains() {
        // Empty
    }
    
    /**
     * Returns a chain object that does nothing.<p>
     * 
     * This is the chain object given to the last middleware of a composed
     * chain.
     * 
     * @return a chain object that does nothing
     */
    public static Chain end() {
        return ChainCursor.END;
    }
    
    /**
     * Composes the given middleware into one endpoint.<p>
     * 
     * The returned endpoint invokes the first middleware. The chain object
     * given to a middleware invokes the next middleware, which in turn receives
     * its own chain object, and so on. The chain object given to the last
     * middleware does nothing.<p>
     * 
     * Execution is synchronous and the call stack grows with each middleware
     * that proceeds. If a middleware does not proceed, the rest of the chain
     * is skipped. If a middleware proceeds many times, the rest of the chain
     * executes many times.<p>
     * 
     * An exception thrown by a middleware propagates through the
     * {@code proceed()} calls of all middleware before it, and out of the
     * returned endpoint.<p>
     * 
     * The list is copied. An empty list produces an endpoint that does
     * nothing. The returned endpoint is thread-safe, assuming the middleware
     * are.
     * 
     * @param handlers to compose, in order of execution
     * 
     * @return an endpoint
     * 
     * @throws NullPointerException
     *             if {@code handlers} or an element therein is {@code null}
     */
    public static Endpoint compose(List<? extends Middleware> handlers) {
        final List<Middleware> copy = List.copyOf(handlers);
        switch (copy.size()) {
            case 0:
                return NOOP;
            case 1:
                final Middleware only = copy.get(0);
                return ctx -> only.accept(ctx, ChainCursor.END);
            default:
                return ctx -> ChainCursor.start(copy, ctx);
        }
    }
    
    /**
     * Composes the given middleware into one endpoint.
     * 
     * @param handlers to compose, in order of execution
     * 
     * @return an endpoint
     * 
     * @throws NullPointerException
     *             if {@code handlers} or an element therein is {@code null}
     * 
     * @see #compose(List)
     */
    public static Endpoint compose(Middleware... handlers) {
        return compose(List.of(handlers));
    }
    
    /**
     * Proceeds the middleware after the one at the cursor's position.<p>
     * 
     * A new cursor is created for each middleware in each dispatch, and so, a
     * cursor is never shared between exchanges.
     */
    private static final class ChainCursor implements Chain
    {
        static final Chain END = () -> {};
        
        static void start(List<Middleware> handlers, Context ctx) throws Exception {
            handlers.get(0).accept(ctx, new ChainCursor(handlers, ctx, 0));
        }
        
        private final List<Middleware> handlers;
        private final Context ctx;
        private final int position;
        
        private ChainCursor(List<Middleware> handlers, Context ctx, int position) {
            this.handlers = handlers;
            this.ctx      = ctx;
            this.position = position;
        }
        
        @Override
        public void proceed() throws Exception {
            final int next = position + 1;
            if (next == handlers.size()) {
                return;
            }
            handlers.get(next).accept(ctx, new ChainCursor(handlers, ctx, next));
        }
        
        @Override
        public String toString() {
            return ChainCursor.class.getSimpleName() + "{" +
                    "position=" + position + ", " +
                    "length=" + handlers.size() + "}";
        }
    }
}
