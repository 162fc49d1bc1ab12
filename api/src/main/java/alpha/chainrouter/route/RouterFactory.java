package alpha.chainrouter.route;

import alpha.chainrouter.Config;

/**
 * Factory of {@code Router}.<p>
 * 
 * Application code should have no use of this type. It is only public because
 * it is a requirement by Java's service-provider mechanism.
 */
@FunctionalInterface
public interface RouterFactory {
    /**
     * Creates a new {@code Router}.<p>
     * 
     * This method should only be used by the static method
     * {@link Router#create(Config, String) Router.create()}.
     * 
     * @param config of router
     * @param prefix of router
     * 
     * @return a new {@code Router}
     * 
     * @throws NullPointerException
     *             if an argument is {@code null}
     */
    Router create(Config config, String prefix);
}
