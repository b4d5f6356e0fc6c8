package jerrinot.info.unitengine.plugin;

import jerrinot.info.unitengine.runner.RunnerArguments;
import org.apache.maven.plugin.MojoExecutionException;
import org.apache.maven.project.MavenProject;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;

class RunMojoTest {

    @TempDir
    Path tempDir;

    @Test
    void parametersMapToRunnerArguments() {
        RunMojo mojo = new RunMojo();
        mojo.filter = "  testPush ";
        mojo.groups = List.of("fast");
        mojo.excludeGroups = List.of("slow");
        mojo.stopOnFailure = true;
        mojo.repeat = 3;
        mojo.reportUselessTests = true;
        mojo.verbose = true;

        RunnerArguments arguments = mojo.toArguments();

        assertEquals("testPush", arguments.getFilter());
        assertEquals(List.of("fast"), arguments.getGroups());
        assertEquals(List.of("slow"), arguments.getExcludeGroups());
        assertTrue(arguments.isStopOnFailure());
        assertEquals(3, arguments.getRepeat());
        assertTrue(arguments.isReportUselessTests());
        assertTrue(arguments.isVerbose());
        assertTrue(arguments.isConvertErrorsToExceptions());
    }

    @Test
    void blankFilterIsIgnored() {
        RunMojo mojo = new RunMojo();
        mojo.filter = " ";

        assertNull(mojo.toArguments().getFilter());
    }

    @Test
    void explicitTestClassesWinOverScanning() throws Exception {
        RunMojo mojo = new RunMojo();
        mojo.testClassesDirectory = tempDir.toFile();
        mojo.testClasses = List.of("com.example.StackTest");

        Map<String, String> discovered = mojo.discoverTestClasses();

        assertEquals(Map.of("com.example.StackTest", "com/example/StackTest.class"), discovered);
    }

    @Test
    void scansTestOutputDirectory() throws Exception {
        Files.createDirectories(tempDir.resolve("com/example"));
        Files.write(tempDir.resolve("com/example/QueueTest.class"), new byte[0]);
        RunMojo mojo = new RunMojo();
        mojo.testClassesDirectory = tempDir.toFile();

        assertEquals(List.of("com.example.QueueTest"), List.copyOf(mojo.discoverTestClasses().keySet()));
    }

    @Test
    void skipDoesNotTouchTheProject() throws Exception {
        RunMojo mojo = new RunMojo();
        mojo.project = mock(MavenProject.class);
        mojo.skip = true;

        mojo.execute();

        verifyNoInteractions(mojo.project);
    }

    @Test
    void negativeRepeatIsRejected() {
        RunMojo mojo = new RunMojo();
        mojo.project = mock(MavenProject.class);
        mojo.testClassesDirectory = tempDir.toFile();
        mojo.testClasses = List.of("com.example.StackTest");
        mojo.repeat = -1;

        assertThrows(MojoExecutionException.class, mojo::execute);
    }
}
