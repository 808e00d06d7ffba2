package co.fanki.testaddress.config;

import co.fanki.testaddress.address.domain.AddressResolver;
import co.fanki.testaddress.fixture.domain.FixtureRunner;
import co.fanki.testaddress.module.domain.ClassPathModuleLoader;
import co.fanki.testaddress.module.domain.ModuleLoader;
import co.fanki.testaddress.module.domain.NameBinder;
import co.fanki.testaddress.path.domain.PackageMapper;
import co.fanki.testaddress.path.domain.PathLocator;
import co.fanki.testaddress.path.domain.SourceRoots;
import co.fanki.testaddress.specifier.domain.SpecifierParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Paths;
import java.util.List;

/**
 * Wires the address resolution components.
 *
 * <p>Properties:</p>
 * <ul>
 *   <li>{@code testaddress.working-directory} - the directory relative
 *       paths resolve against; the process directory when empty</li>
 *   <li>{@code testaddress.source-roots} - comma separated source roots,
 *       relative to the working directory</li>
 * </ul>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Configuration
public class AddressingConfiguration {

    private static final Logger LOG = LoggerFactory.getLogger(
            AddressingConfiguration.class);

    /**
     * Creates the path locator.
     *
     * @param workingDirectory the configured working directory
     * @return the path locator
     */
    @Bean
    public PathLocator pathLocator(
            @Value("${testaddress.working-directory:}")
            final String workingDirectory) {
        final PathLocator locator = workingDirectory.isBlank()
                ? PathLocator.forCurrentDirectory()
                : new PathLocator(Paths.get(workingDirectory));
        LOG.info("Resolving paths against {}", locator.workingDirectory());
        return locator;
    }

    /**
     * Creates the source roots.
     *
     * @param pathLocator the path locator
     * @param roots the configured source roots
     * @return the source roots
     */
    @Bean
    public SourceRoots sourceRoots(final PathLocator pathLocator,
            @Value("${testaddress.source-roots:src/main/java,src/test/java}")
            final List<String> roots) {
        final SourceRoots sourceRoots = SourceRoots.of(pathLocator, roots);
        LOG.info("Source roots: {}", sourceRoots.roots());
        return sourceRoots;
    }

    /**
     * Creates the package mapper.
     *
     * @param pathLocator the path locator
     * @return the package mapper
     */
    @Bean
    public PackageMapper packageMapper(final PathLocator pathLocator) {
        return new PackageMapper(pathLocator);
    }

    /**
     * Creates the specifier parser.
     *
     * @param pathLocator the path locator
     * @return the specifier parser
     */
    @Bean
    public SpecifierParser specifierParser(final PathLocator pathLocator) {
        return new SpecifierParser(pathLocator);
    }

    /**
     * Creates the module loader over the context class loader.
     *
     * @param packageMapper the package mapper
     * @param sourceRoots the source roots
     * @return the module loader
     */
    @Bean
    public ModuleLoader moduleLoader(final PackageMapper packageMapper,
            final SourceRoots sourceRoots) {
        return new ClassPathModuleLoader(
                Thread.currentThread().getContextClassLoader(),
                packageMapper, sourceRoots);
    }

    /**
     * Creates the name binder.
     *
     * @param moduleLoader the module loader
     * @return the name binder
     */
    @Bean
    public NameBinder nameBinder(final ModuleLoader moduleLoader) {
        return new NameBinder(moduleLoader);
    }

    /**
     * Creates the address resolver.
     *
     * @param moduleLoader the module loader
     * @return the address resolver
     */
    @Bean
    public AddressResolver addressResolver(final ModuleLoader moduleLoader) {
        return new AddressResolver(moduleLoader);
    }

    /**
     * Creates the fixture runner.
     *
     * @return the fixture runner
     */
    @Bean
    public FixtureRunner fixtureRunner() {
        return new FixtureRunner();
    }

}
