package co.fanki.archgraph.config;

import co.fanki.archgraph.graph.domain.ArchitectureGraphBuilder;
import co.fanki.archgraph.graph.domain.DependencyGraph;
import co.fanki.archgraph.graph.domain.GraphCacheKey;
import co.fanki.archgraph.graph.domain.SourceFileSampler;
import co.fanki.archgraph.shared.BoundedCache;
import co.fanki.archgraph.shared.LruCache;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the graph builder and the process-wide result cache.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Configuration
public class GraphConfiguration {

    private static final Logger LOG = LoggerFactory.getLogger(
            GraphConfiguration.class);

    /**
     * Creates the graph builder with every language extractor.
     *
     * @param perDirectoryCap the per-directory sample cap
     * @return the builder
     */
    @Bean
    public ArchitectureGraphBuilder architectureGraphBuilder(
            @Value("${archgraph.sampling.per-directory-cap:20}")
            final int perDirectoryCap) {
        return new ArchitectureGraphBuilder(
                new SourceFileSampler(perDirectoryCap));
    }

    /**
     * Creates the result cache shared by all requests.
     *
     * @param capacity the maximum number of cached graphs
     * @return the cache
     */
    @Bean
    public BoundedCache<GraphCacheKey, DependencyGraph> graphCache(
            @Value("${archgraph.cache.capacity:64}") final int capacity) {
        LOG.info("Architecture graph cache capacity: {}", capacity);
        return new LruCache<>(capacity);
    }

}
