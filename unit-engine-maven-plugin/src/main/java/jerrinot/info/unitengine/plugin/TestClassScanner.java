package jerrinot.info.unitengine.plugin;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Finds compiled test classes under a class output directory.
 */
public class TestClassScanner {
    static final String CLASS_SUFFIX = ".class";
    static final String DEFAULT_PATTERN = "Test";

    private final String nameSuffix;

    public TestClassScanner() {
        this(DEFAULT_PATTERN);
    }

    public TestClassScanner(String nameSuffix) {
        this.nameSuffix = nameSuffix;
    }

    /**
     * Top-level classes whose simple name ends with the configured suffix, sorted by path.
     *
     * @return class name to path relative to {@code classesDir}; empty when the directory does not exist
     */
    public Map<String, String> scan(Path classesDir) throws IOException {
        Map<String, String> result = new LinkedHashMap<>();
        if (!Files.isDirectory(classesDir)) {
            return result;
        }
        List<Path> classFiles;
        try (Stream<Path> paths = Files.walk(classesDir)) {
            classFiles = paths.filter(Files::isRegularFile)
                    .filter(this::isTestClassFile)
                    .sorted()
                    .collect(Collectors.toList());
        }
        for (Path classFile : classFiles) {
            Path relative = classesDir.relativize(classFile);
            result.put(toClassName(relative), relative.toString().replace('\\', '/'));
        }
        return result;
    }

    boolean isTestClassFile(Path file) {
        String fileName = file.getFileName().toString();
        if (!fileName.endsWith(CLASS_SUFFIX) || fileName.indexOf('$') >= 0) {
            return false;
        }
        String simpleName = fileName.substring(0, fileName.length() - CLASS_SUFFIX.length());
        return simpleName.endsWith(nameSuffix);
    }

    static String toClassName(Path relative) {
        String path = relative.toString().replace('\\', '/');
        return path.substring(0, path.length() - CLASS_SUFFIX.length()).replace('/', '.');
    }
}
