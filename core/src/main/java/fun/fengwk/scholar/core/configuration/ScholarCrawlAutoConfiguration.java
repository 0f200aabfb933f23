package fun.fengwk.scholar.core.configuration;

import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.ComponentScan;

/**
 * Registers the crawl engine: properties, page session factory, extraction pipeline, progress publisher
 * and the crawl service.
 *
 * @author fengwk
 */
@AutoConfiguration
@EnableConfigurationProperties
@ComponentScan(basePackages = "fun.fengwk.scholar.core.service")
public class ScholarCrawlAutoConfiguration {
}
