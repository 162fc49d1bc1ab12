/**
 * An exact-match request router with continuation-passing middleware
 * chains.<p>
 * 
 * The entry point is {@link alpha.chainrouter.route.Router#create()}. The
 * router consumes an exchange through the narrow
 * {@link alpha.chainrouter.Context} interface, which the surrounding server
 * implements. Routers are mounted in a {@link alpha.chainrouter.Pipeline}, or
 * used directly as one stage of the server's own pipeline.
 */
package alpha.chainrouter;
