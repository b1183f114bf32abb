package backend;

import static com.google.common.truth.Truth.assertThat;

import ir.ByteFlow;
import ir.FlowFixtures;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class RegionTreePrinterTest {

    @Test
    public void leaves() {
        ByteFlow flow = ByteFlow.fromInstructions(FlowFixtures.scenarioA());

        assertThat(RegionTreePrinter.print(flow.getBlockMap())).isEqualTo(
                "leaf 0 -> [14, 4]\n"
                        + "leaf 4 -> [12, 8]\n"
                        + "leaf 8 -> [18]\n"
                        + "leaf 12 -> [14]\n"
                        + "leaf 14 -> [18]\n"
                        + "leaf 18 -> []\n");
    }

    @Test
    public void loopRegion() {
        ByteFlow flow = ByteFlow.fromInstructions(FlowFixtures.scenarioSingleEntryLoop()).restructureLoop();

        assertThat(RegionTreePrinter.print(flow.getBlockMap())).isEqualTo(
                "leaf 0 -> [18, 4]\n"
                        + "leaf 8 -> [18]\n"
                        + "leaf 18 -> []\n"
                        + "loop 4 -> [8] exit 4\n"
                        + "  [header] leaf 4 -> [12, 8]\n"
                        + "  leaf 12 -> [] backedges [4]\n");
    }

    @Test
    public void nestedRegionsAreIndented() {
        ByteFlow flow = ByteFlow.fromInstructions(FlowFixtures.scenarioSingleEntryLoop()).restructure();

        String tree = RegionTreePrinter.print(flow.getBlockMap());

        assertThat(tree).startsWith("head 0 -> []\n  [header] head 0 -> [c0, 4]\n    [header] leaf 0 -> [c0, 4]\n");
        assertThat(tree).contains("\n      [header] leaf 4 -> [12, 8]\n");
        assertThat(tree).contains("\n  branch c0 -> [18] exit c0\n    leaf c0 -> [18]\n");
    }
}
