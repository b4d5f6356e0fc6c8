package jerrinot.info.unitengine.plugin;

import jerrinot.info.unitengine.framework.EngineException;
import jerrinot.info.unitengine.runner.RunnerArguments;
import jerrinot.info.unitengine.runner.StandardTestSuiteLoader;
import jerrinot.info.unitengine.runner.TestRunner;
import org.apache.maven.artifact.DependencyResolutionRequiredException;
import org.apache.maven.plugin.AbstractMojo;
import org.apache.maven.plugin.MojoExecutionException;
import org.apache.maven.plugin.MojoFailureException;
import org.apache.maven.plugins.annotations.LifecyclePhase;
import org.apache.maven.plugins.annotations.Mojo;
import org.apache.maven.plugins.annotations.Parameter;
import org.apache.maven.plugins.annotations.ResolutionScope;
import org.apache.maven.project.MavenProject;

import java.io.File;
import java.io.IOException;
import java.net.MalformedURLException;
import java.net.URL;
import java.net.URLClassLoader;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Mojo(name = "run", defaultPhase = LifecyclePhase.TEST,
        requiresDependencyResolution = ResolutionScope.TEST, threadSafe = true)
public class RunMojo extends AbstractMojo {

    @Parameter(defaultValue = "${project}", readonly = true, required = true)
    MavenProject project;

    @Parameter(defaultValue = "${project.build.testOutputDirectory}")
    File testClassesDirectory;

    /**
     * Test classes to run. When empty, every {@code *Test} class of the test output directory runs.
     */
    @Parameter(property = "unitengine.testClasses")
    List<String> testClasses;

    @Parameter(property = "unitengine.filter")
    String filter;

    @Parameter(property = "unitengine.groups")
    List<String> groups;

    @Parameter(property = "unitengine.excludeGroups")
    List<String> excludeGroups;

    @Parameter(property = "unitengine.stopOnError", defaultValue = "false")
    boolean stopOnError;

    @Parameter(property = "unitengine.stopOnFailure", defaultValue = "false")
    boolean stopOnFailure;

    @Parameter(property = "unitengine.stopOnIncomplete", defaultValue = "false")
    boolean stopOnIncomplete;

    @Parameter(property = "unitengine.stopOnRisky", defaultValue = "false")
    boolean stopOnRisky;

    @Parameter(property = "unitengine.stopOnSkipped", defaultValue = "false")
    boolean stopOnSkipped;

    @Parameter(property = "unitengine.repeat", defaultValue = "0")
    int repeat;

    @Parameter(property = "unitengine.reportUselessTests", defaultValue = "false")
    boolean reportUselessTests;

    @Parameter(property = "unitengine.disallowTestOutput", defaultValue = "false")
    boolean disallowTestOutput;

    @Parameter(property = "unitengine.disallowTodoAnnotatedTests", defaultValue = "false")
    boolean disallowTodoAnnotatedTests;

    @Parameter(property = "unitengine.verbose", defaultValue = "false")
    boolean verbose;

    @Parameter(property = "unitengine.skip", defaultValue = "false")
    boolean skip;

    @Override
    public void execute() throws MojoExecutionException, MojoFailureException {
        if (skip) {
            getLog().info("Unit engine tests are skipped");
            return;
        }

        Map<String, String> discovered;
        try {
            discovered = discoverTestClasses();
        } catch (IOException e) {
            throw new MojoExecutionException("Failed to scan " + testClassesDirectory, e);
        }
        if (discovered.isEmpty()) {
            getLog().info("No test classes found in " + testClassesDirectory);
            return;
        }
        RunnerArguments arguments;
        try {
            arguments = toArguments();
        } catch (EngineException e) {
            throw new MojoExecutionException(e.getMessage(), e);
        }
        getLog().info("Running " + discovered.size() + " test classes");

        int exitCode;
        Thread thread = Thread.currentThread();
        ClassLoader previous = thread.getContextClassLoader();
        try (URLClassLoader loader = new URLClassLoader(testClasspath(), previous)) {
            thread.setContextClassLoader(loader);
            TestRunner runner = new TestRunner(System.out, new StandardTestSuiteLoader(loader));
            exitCode = runner.start(project.getArtifactId(), discovered, arguments);
        } catch (IOException e) {
            throw new MojoExecutionException("Failed to close the test class loader", e);
        } finally {
            thread.setContextClassLoader(previous);
        }

        if (exitCode == TestRunner.FAILURE_EXIT) {
            throw new MojoFailureException("There are test failures");
        }
        if (exitCode == TestRunner.EXCEPTION_EXIT) {
            throw new MojoExecutionException("Tests could not be run, see the output above");
        }
    }

    Map<String, String> discoverTestClasses() throws IOException {
        if (testClasses != null && !testClasses.isEmpty()) {
            Map<String, String> explicit = new LinkedHashMap<>();
            for (String className : testClasses) {
                explicit.put(className, className.replace('.', '/') + TestClassScanner.CLASS_SUFFIX);
            }
            return explicit;
        }
        return new TestClassScanner().scan(testClassesDirectory.toPath());
    }

    private URL[] testClasspath() throws MojoExecutionException {
        List<String> elements;
        try {
            elements = project.getTestClasspathElements();
        } catch (DependencyResolutionRequiredException e) {
            throw new MojoExecutionException("Test classpath is not resolved", e);
        }
        List<URL> urls = new ArrayList<>();
        for (String element : elements) {
            try {
                urls.add(new File(element).toURI().toURL());
            } catch (MalformedURLException e) {
                throw new MojoExecutionException("Invalid classpath element " + element, e);
            }
        }
        getLog().debug("Test classpath: " + elements);
        return urls.toArray(new URL[0]);
    }

    RunnerArguments toArguments() {
        RunnerArguments.Builder builder = RunnerArguments.builder()
                .stopOnError(stopOnError)
                .stopOnFailure(stopOnFailure)
                .stopOnIncomplete(stopOnIncomplete)
                .stopOnRisky(stopOnRisky)
                .stopOnSkipped(stopOnSkipped)
                .repeat(repeat)
                .reportUselessTests(reportUselessTests)
                .disallowTestOutput(disallowTestOutput)
                .disallowTodoAnnotatedTests(disallowTodoAnnotatedTests)
                .verbose(verbose);
        if (filter != null && !filter.isBlank()) {
            builder.filter(filter.trim());
        }
        if (groups != null) {
            builder.groups(groups);
        }
        if (excludeGroups != null) {
            builder.excludeGroups(excludeGroups);
        }
        return builder.build();
    }
}
