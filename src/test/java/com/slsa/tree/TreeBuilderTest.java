package com.slsa.tree;

import com.slsa.syntax.Syntaxes;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TreeBuilderTest {

    private StructureTree tree;
    private TreeBuilder builder;

    @BeforeEach
    void setUp() {
        tree = new StructureTree();
        builder = new TreeBuilder(tree);
    }

    private TreeNode onlyChild(int id) {
        List<Integer> children = tree.children(id);
        assertEquals(1, children.size(), "children of " + tree.node(id));
        return tree.node(children.get(0));
    }

    @Test
    @DisplayName("a lone IPv4 address becomes one special node under root")
    void testSingleIpv4Line() {
        assertTrue(builder.insert("192.168.0.1"));

        TreeNode n = onlyChild(tree.root());
        assertEquals(1, n.valueCount());
        assertEquals(Syntaxes.IPV4, n.firstValue().getText());
        assertTrue(n.firstValue().isSpecial());
        assertEquals(1, n.getTerminalCount());
        assertFalse(n.hasChild());
    }

    @Test
    void testSameLineTwiceCountsOccurrences() {
        builder.insert("disk full");
        builder.insert("disk full");

        TreeNode disk = onlyChild(tree.root());
        assertEquals(2, disk.firstValue().getOccurrences());
        TreeNode full = onlyChild(disk.getId());
        assertEquals(2, full.firstValue().getOccurrences());
        assertEquals(2, full.getTerminalCount());
    }

    @Test
    @DisplayName("lines ending at the same depth share the last node")
    void testLineEndsReconverge() {
        builder.insert("user=alice");
        builder.insert("user=bob");

        TreeNode n = onlyChild(tree.root());
        assertEquals(2, n.valueCount());
        assertEquals("user=alice", n.getValues().get(0).getText());
        assertEquals("user=bob", n.getValues().get(1).getText());
        assertEquals(2, n.getTerminalCount());
    }

    @Test
    void testRepeatedAlternativeCounts() {
        builder.insert("a b");
        builder.insert("a c");
        builder.insert("a b");

        TreeNode a = onlyChild(tree.root());
        assertEquals(3, a.firstValue().getOccurrences());
        TreeNode second = onlyChild(a.getId());
        assertEquals(2, second.valueCount());
        assertEquals(2, second.findValue("b").getOccurrences());
        assertEquals(1, second.findValue("c").getOccurrences());
        assertEquals(3, second.getTerminalCount());
    }

    @Test
    @DisplayName("values followed by the same literal merge into one node")
    void testLookaheadMerge() {
        builder.insert("GET status=200 OK-check");
        builder.insert("GET status=404 OK-check");

        TreeNode get = onlyChild(tree.root());
        TreeNode status = onlyChild(get.getId());
        assertEquals(2, status.valueCount());
        assertNotNull(status.findValue("status=200"));
        assertNotNull(status.findValue("status=404"));
        TreeNode check = onlyChild(status.getId());
        assertEquals("OK-check", check.firstValue().getText());
        assertEquals(2, check.firstValue().getOccurrences());
        assertEquals(2, check.getTerminalCount());
    }

    @Test
    void testDifferentContinuationsBranch() {
        builder.insert("job start fast");
        builder.insert("job stop now");

        TreeNode job = onlyChild(tree.root());
        List<Integer> level2 = tree.children(job.getId());
        assertEquals(2, level2.size());
        assertEquals("start", tree.node(level2.get(0)).firstValue().getText());
        assertEquals("stop", tree.node(level2.get(1)).firstValue().getText());
    }

    @Test
    @DisplayName("lookahead does not merge when the follow-up position holds several values")
    void testLookaheadNeedsSingleFollowUpValue() {
        builder.insert("x a end");
        builder.insert("x a fin");          // reconverges into the "end" node: {end, fin}
        builder.insert("x b end");

        TreeNode x = onlyChild(tree.root());
        List<Integer> level2 = tree.children(x.getId());
        assertEquals(2, level2.size());
        assertEquals("b", tree.node(level2.get(1)).firstValue().getText());
    }

    @Test
    @DisplayName("lookahead does not merge when the follow-up position has siblings")
    void testLookaheadNeedsSoleFollowUpNode() {
        builder.insert("x a end");
        builder.insert("x a more tail");    // "a" now continues with "end" or "more"
        builder.insert("x b end");

        TreeNode x = onlyChild(tree.root());
        List<Integer> level2 = tree.children(x.getId());
        assertEquals(2, level2.size());
        assertEquals(2, tree.children(level2.get(0)).size());
    }

    @Test
    @DisplayName("blank lines record nothing")
    void testBlankLine() {
        assertFalse(builder.insert(""));
        assertFalse(builder.insert("   \t"));

        assertEquals(1, tree.size());
        assertEquals(0, tree.totalTerminalCount());
        assertEquals(0, builder.getLinesAdded());
    }

    @Test
    void testCompositeTokensExtendThePath() {
        builder.insert("net 10.0.0.0/8");

        TreeNode net = onlyChild(tree.root());
        TreeNode ip = onlyChild(net.getId());
        assertEquals(Syntaxes.IPV4, ip.firstValue().getText());
        TreeNode slash = onlyChild(ip.getId());
        assertEquals("/", slash.firstValue().getText());
        TreeNode len = onlyChild(slash.getId());
        assertEquals(Syntaxes.POSINT, len.firstValue().getText());
        assertEquals(1, len.getTerminalCount());
    }

    @Test
    void testPreprocessedDatesBecomeOneToken() {
        builder.insert("Oct 11 22:14:15 host sshd: accepted");
        builder.insert("Nov  2 01:00:00 host sshd: accepted");

        TreeNode date = onlyChild(tree.root());
        assertEquals(Syntaxes.DATE_RFC3164, date.firstValue().getText());
        assertEquals(2, date.firstValue().getOccurrences());
    }

    @Test
    void testTerminalCountsMatchLinesAdded() {
        String[] lines = {"a", "a b", "a b c", "x y", "", "a b", "  ", "z"};
        for (String line : lines) {
            builder.insert(line);
        }
        assertEquals(6, builder.getLinesAdded());
        assertEquals(6, tree.totalTerminalCount());
    }
}
