/**
 * The {@link alpha.chainrouter.route.Router} API.<p>
 * 
 * A router maps a method and a path to a composed chain of middleware. Routes
 * are matched exactly; there are no path parameters, wildcards or regular
 * expressions.
 */
package alpha.chainrouter.route;
