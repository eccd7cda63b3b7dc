package info.isaksson.erland.xdlc.version;

import info.isaksson.erland.xdlc.ast.Declaration;
import info.isaksson.erland.xdlc.ast.Version;
import info.isaksson.erland.xdlc.io.DeclarationTable;
import info.isaksson.erland.xdlc.parse.XdlParser;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class BreakpointsTest {

    private static final Version V1 = Version.of(1, 0, 0, 0);
    private static final Version V2 = Version.of(2, 0, 0, 0);
    private static final Version V3 = Version.of(3, 0, 0, 0);

    private static List<Declaration> parse(String text) {
        return XdlParser.parse("test.xdl", text).declarations();
    }

    @Test
    void breakpointsAreSortedAndDistinctWhateverTheSourceOrder() {
        Declaration d = parse("""
                struct S {
                    [added(3,0)] int c;
                    [added(1,0), removed(3,0)] int a;
                    [removed(2,0)] int b;
                    [added(1,0)] int d;
                };
                """).get(0);
        assertEquals(List.of(V1, V2, V3), Breakpoints.collect(d, VersionAxis.DATA));
    }

    @Test
    void axesSeeOnlyTheirOwnMembers() {
        Declaration d = parse("""
                [added(9,0)]
                interface I : [added(4,0)] IBase {
                    [added(1,0)] int field;
                    [added(2,0)] HRESULT Code();
                    [hidden_return, added(3,0)] Rect Bounds();
                    [conditional(X)] {
                        [added(5,0)] HRESULT Guarded();
                    }
                };
                """).get(0);

        assertEquals(List.of(V1), Breakpoints.collect(d, VersionAxis.DATA));
        assertEquals(List.of(V2, V3, Version.of(5, 0, 0, 0)), Breakpoints.collect(d, VersionAxis.CODE));
        assertEquals(List.of(Version.of(4, 0, 0, 0)), Breakpoints.collect(d, VersionAxis.BASE_TYPE));
        assertEquals(List.of(V3), Breakpoints.collect(d, VersionAxis.HIDDEN_RETURN));
    }

    @Test
    void enumAxisIncludesTheEnumsOwnAttributes() {
        Declaration e = parse("[added(1,0)] enum Mode : int { A, [added(2,0)] B, };").get(0);
        assertEquals(List.of(V1, V2), Breakpoints.collect(e, VersionAxis.ENUM));
    }

    @Test
    void blocksWithoutRelevantMembersAreNotEntered() {
        Declaration d = parse("""
                struct S {
                    [added(7,0)] {
                        HRESULT OnlyCode();
                    }
                    int x;
                };
                """).get(0);
        assertTrue(Breakpoints.collect(d, VersionAxis.DATA).isEmpty());
        assertEquals(List.of(Version.of(7, 0, 0, 0)), Breakpoints.collect(d, VersionAxis.CODE));
    }

    @Test
    void transitiveScanFollowsReferencesAndStopsOnCycles() {
        DeclarationTable table = new DeclarationTable();
        Path file = Path.of("test.xdl");
        for (Declaration d : parse("""
                struct Leaf { [added(2,0)] int x; };
                struct Middle { Leaf *leaf; Outer *back; };
                struct Outer : Middle { };
                struct Plain { int y; Unknown *u; };
                """)) {
            table.register(d, DeclarationTable.Origin.ROOT, file);
        }

        assertEquals(List.of(V2), Breakpoints.transitive(table.lookup("Outer").orElseThrow().declaration(), table));
        assertEquals(List.of(V2), Breakpoints.transitive(table.lookup("Middle").orElseThrow().declaration(), table));
        assertTrue(Breakpoints.transitive(table.lookup("Plain").orElseThrow().declaration(), table).isEmpty());
    }

    @Test
    void windowsPartitionAtEachBreakpoint() {
        List<VersionWindow> windows = VersionWindow.partition(List.of(V1, V3));
        assertEquals(3, windows.size());

        assertTrue(windows.get(0).isPrimary());
        assertEquals(Version.ZERO, windows.get(0).at());
        assertEquals("", windows.get(0).requiresClause());
        assertEquals("requires (ABI >= abi_t{1,0,0,0} && ABI < abi_t{3,0,0,0})", windows.get(1).requiresClause());
        assertEquals("requires (ABI >= abi_t{3,0,0,0})", windows.get(2).requiresClause());
        assertEquals(V3, windows.get(2).at());

        assertEquals(1, VersionWindow.partition(List.of()).size());
    }

    @Test
    void zeroBreakpointFoldsIntoThePrimaryWindow() {
        List<VersionWindow> windows = VersionWindow.partition(List.of(Version.ZERO, V1));

        assertEquals(2, windows.size());
        assertTrue(windows.get(0).isPrimary());
        assertEquals(V1, windows.get(0).upper());
        assertEquals("requires (ABI >= abi_t{1,0,0,0})", windows.get(1).requiresClause());
        assertEquals(1, VersionWindow.partition(List.of(Version.ZERO)).size());
    }
}
