/**
 * Home of the library-provided router implementation.<p>
 * 
 * The public type in this package is {@link
 * alpha.chainrouter.core.DefaultRouter}, which is used by the {@link
 * alpha.chainrouter.route.Router} interface as the default implementation,
 * together with the service provider
 * {@link alpha.chainrouter.core.DefaultRouterFactory}. All other types in this
 * package can be regarded as an implementation detail.<p>
 * 
 * Unless documented differently, all methods within this package expect to be
 * given non-null arguments and will return non-null results.
 */
package alpha.chainrouter.core;
