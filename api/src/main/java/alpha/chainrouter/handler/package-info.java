/**
 * Handler shapes, and the utilities that normalize and compose them.<p>
 * 
 * The canonical handler is the {@link alpha.chainrouter.handler.Middleware}.
 * Other shapes are adapted by {@link alpha.chainrouter.handler.Handlers}, and
 * an ordered sequence of middleware is composed into one
 * {@link alpha.chainrouter.handler.Endpoint} by
 * {@link alpha.chainrouter.handler.Chains}.<p>
 * 
 * Unless documented differently, all methods in this package throw
 * {@code NullPointerException} if given a {@code null} argument.
 */
package alpha.chainrouter.handler;
