package alpha.chainrouter.handler;

import alpha.chainrouter.Chain;
import alpha.chainrouter.Context;

/**
 * A handler that decides whether, and when, to proceed the rest of the
 * chain.<p>
 * 
 * This is the canonical handler shape. All other shapes are normalized into a
 * middleware by {@link Handlers}, and a sequence of middleware is composed into
 * one {@link Endpoint} by {@link Chains}.<p>
 * 
 * For example, a guard:
 * 
 * <pre>{@code
 *   Middleware guard = (ctx, chain) -> {
 *       if (isAuthorized(ctx)) {
 *           chain.proceed();
 *       } else {
 *           ctx.status(401);
 *       }
 *   };
 * }</pre>
 * 
 * Code placed after {@code chain.proceed()} executes after the rest of the
 * chain has returned.
 */
@FunctionalInterface
public interface Middleware
{
    /**
     * Handles the exchange.
     * 
     * @param ctx the context (never {@code null})
     * @param chain the rest of the chain (never {@code null})
     * 
     * @throws Exception
     *             for any reason, propagated as-is to the dispatcher's caller
     */
    void accept(Context ctx, Chain chain) throws Exception;
}
