package alpha.chainrouter.core;

import alpha.chainrouter.Config;
import alpha.chainrouter.route.Router;
import alpha.chainrouter.route.RouterFactory;

/**
 * Default {@code RouterFactory}.<p>
 * 
 * This class is specified in the provider configuration file, which is how
 * {@link Router#create(Config, String)} finds the implementation.
 */
public class DefaultRouterFactory implements RouterFactory
{
    /**
     * Constructs this object.
     */
    public DefaultRouterFactory() {
        // Empty
    }
    
    @Override
    public Router create(Config config, String prefix) {
        return new DefaultRouter(config, prefix);
    }
}
