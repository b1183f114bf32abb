package driver;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import exception.RestructureException;
import ir.ByteFlow;
import java.io.File;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import org.junit.After;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import pass.PassManager;

@RunWith(JUnit4.class)
public final class ScfgDriverTest {

    private static final String LISTING = String.join("\n",
            "  0 LOAD_FAST 0 (x)",
            "  2 POP_JUMP_IF_TRUE 8",
            "  4 LOAD_CONST 1 (1)",
            "  6 RETURN_VALUE",
            ">> 8 LOAD_CONST 2 (2)",
            " 10 RETURN_VALUE",
            "");

    @Rule
    public final TemporaryFolder tmp = new TemporaryFolder();

    private final ScfgDriver driver = ScfgDriver.getInstance();

    @After
    public void tearDown() {
        PassManager.resetInstance();
    }

    private static RestructureException.Kind argumentFailure(String... args) {
        RestructureException e = assertThrows(RestructureException.class,
                () -> ScfgDriver.getInstance().parseArgs(args));
        return e.getKind();
    }

    @Test
    public void parseArgs() {
        driver.parseArgs(new String[] {"flow.dis", "-o", "flow.dot", "--tree"});

        assertThat(driver.getSource()).isEqualTo("flow.dis");
        assertThat(driver.getTarget()).isEqualTo("flow.dot");
        assertThat(driver.isPrintTree()).isTrue();

        driver.parseArgs(new String[] {"other.dis"});
        assertThat(driver.getTarget()).isNull();
        assertThat(driver.isPrintTree()).isFalse();
    }

    @Test
    public void badArgs() {
        assertThat(argumentFailure()).isEqualTo(RestructureException.Kind.ARGUMENT);
        assertThat(argumentFailure("-o")).isEqualTo(RestructureException.Kind.ARGUMENT);
        assertThat(argumentFailure("--tree")).isEqualTo(RestructureException.Kind.ARGUMENT);
        assertThat(argumentFailure("a.dis", "b.dis")).isEqualTo(RestructureException.Kind.ARGUMENT);
        assertThat(argumentFailure("-x", "a.dis")).isEqualTo(RestructureException.Kind.ARGUMENT);
    }

    @Test
    public void writesDot() throws Exception {
        File listing = tmp.newFile("flow.dis");
        Files.write(listing.toPath(), LISTING.getBytes(StandardCharsets.UTF_8));
        File dot = new File(tmp.getRoot(), "flow.dot");

        driver.parseArgs(new String[] {listing.getPath(), "-o", dot.getPath()});
        ByteFlow result = driver.run();

        assertThat(result.getBlockMap().size()).isEqualTo(1);
        String written = new String(Files.readAllBytes(dot.toPath()), StandardCharsets.UTF_8);
        assertThat(written).startsWith("digraph {");
        assertThat(written).contains("Control Label: 0");
    }

    @Test
    public void missingListing() {
        driver.parseArgs(new String[] {new File(tmp.getRoot(), "missing.dis").getPath()});

        assertThrows(RuntimeException.class, driver::run);
    }
}
