package io.github.galkahana.testrunner.loader;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.ServiceLoader;
import java.util.TreeMap;

import io.github.galkahana.testrunner.Globs;
import lombok.extern.slf4j.Slf4j;

/**
 * {@link Loader} over the {@link TestGroup}s registered as services on the classpath.
 * <p>
 * A name resolves directly if it is a group name, or a group name followed by {@code .} and
 * the id suffix of one of that group's members. Anything else must be found by walking groups.
 * Discovery maps a directory below the top-level directory to a dotted package prefix and
 * selects groups under it whose simple name matches the pattern; {@code .} selects everything.
 */
@Slf4j
public class ServiceLoaderLoader implements Loader {

    private final Map<String, TestGroup> groups = new TreeMap<>();

    public ServiceLoaderLoader() {
        this(ServiceLoader.load(TestGroup.class));
    }

    public ServiceLoaderLoader(Iterable<? extends TestGroup> registered) {
        for (TestGroup group : registered) {
            TestGroup previous = groups.put(group.name(), group);
            if (previous != null) {
                log.warn("Test group {} registered more than once, keeping {}", group.name(), group.getClass().getName());
            }
        }
        log.debug("Loaded {} test groups", groups.size());
    }

    @Override
    public List<TestCase> loadTestsFromName(String name) throws LoadException {
        TestGroup group = groups.get(name);
        if (group != null) return List.copyOf(group.tests());

        int lastDot = name.lastIndexOf('.');
        if (lastDot > 0) {
            TestGroup parent = groups.get(name.substring(0, lastDot));
            if (parent != null) {
                for (TestCase test : parent.tests()) {
                    if (test.id().equals(name)) return List.of(test);
                }
                throw new LoadException("group " + parent.name() + " has no test named " + name.substring(lastDot + 1));
            }
        }
        throw new LoadException("no test or group named " + name);
    }

    @Override
    public List<TestCase> discover(String startDir, String pattern, String topLevelDir) throws LoadException {
        String prefix = packagePrefix(startDir, topLevelDir);
        List<TestCase> found = new ArrayList<>();
        for (TestGroup group : groups.values()) {
            String name = group.name();
            if (!prefix.isEmpty() && !name.equals(prefix) && !name.startsWith(prefix + ".")) continue;
            String simpleName = name.substring(name.lastIndexOf('.') + 1);
            if (Globs.matches(simpleName, pattern)) {
                found.addAll(group.tests());
            }
        }
        return found;
    }

    @Override
    public Optional<TestGroup> loadGroup(String name) {
        return Optional.ofNullable(groups.get(name));
    }

    private static String packagePrefix(String startDir, String topLevelDir) throws LoadException {
        Path top = Path.of(topLevelDir).toAbsolutePath().normalize();
        Path start = Path.of(startDir).toAbsolutePath().normalize();
        if (!start.startsWith(top)) {
            throw new LoadException(startDir + " is not below the top-level directory " + topLevelDir);
        }
        List<String> parts = new ArrayList<>();
        for (Path part : top.relativize(start)) {
            if (!part.toString().isEmpty()) parts.add(part.toString());
        }
        return String.join(".", parts);
    }
}
