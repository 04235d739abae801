package co.fanki.archgraph;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Architecture Graph Application.
 *
 * <p>Main entry point of the service that clones a repository's default
 * branch, extracts the imports of its source files and serves a
 * size-bounded dependency graph for visualization.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@SpringBootApplication
public class ArchGraphApplication {

    /**
     * Main entry point for the application.
     *
     * @param args command line arguments
     */
    public static void main(final String[] args) {
        SpringApplication.run(ArchGraphApplication.class, args);
    }

}
