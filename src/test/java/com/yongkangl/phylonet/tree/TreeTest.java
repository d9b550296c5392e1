package com.yongkangl.phylonet.tree;

import com.yongkangl.phylonet.io.NewickReader;
import com.yongkangl.phylonet.io.NewickWriter;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class TreeTest {
    private static final double EPS = 1e-12;

    @Test
    public void testNodeAges() {
        Tree tree = NewickReader.readNewick("((A:1,B:2):1,C:3);");
        assertTrue(tree.isTimeTree());
        assertEquals(3.0, tree.getRoot().getHeight(), EPS);
        assertEquals(2.0, tree.getNode(1).getHeight(), EPS);
        assertEquals(1.0, tree.getNodeByLabel("A").getHeight(), EPS);
        assertEquals(0.0, tree.getNodeByLabel("B").getHeight(), EPS);
        assertEquals(0.0, tree.getNodeByLabel("C").getHeight(), EPS);
    }

    @Test
    public void testMissingBranchLengthMakesHeightsUndefined() {
        Tree tree = NewickReader.readNewick("((A:1,B):1,C:3);");
        assertFalse(tree.isTimeTree());
        for (Node node : tree.getNodeList()) {
            assertTrue(Double.isNaN(node.getHeight()));
        }
    }

    @Test
    public void testSingleNodeIsNotTimeTree() {
        Tree tree = NewickReader.readNewick("A;");
        assertFalse(tree.isTimeTree());
        assertEquals(0.0, tree.getRoot().getHeight(), EPS);
        assertEquals(Collections.singletonList("A"), tree.getTipLabels());
    }

    @Test
    public void testLookups() {
        Tree tree = NewickReader.readNewick("((A:1,B:2):1,C:3);");
        assertEquals(5, tree.getNodeList().size());
        assertEquals(Arrays.asList("A", "B", "C"), tree.getTipLabels());
        assertEquals("B", tree.getNode(3).getLabel());
        assertNull(tree.getNode(42));
        assertNull(tree.getNodeByLabel("D"));
        assertEquals(Arrays.asList("A", "B"), tree.getTipLabels(tree.getNode(1)));
        assertEquals(Arrays.asList(null, 1.0, 1.0, 2.0, 3.0), tree.getBranchLengths());
    }

    @Test
    public void testRootToTipDistancesAndTotalLength() {
        Tree tree = NewickReader.readNewick("((A:1,B:2):1,C:3);");
        assertEquals(Arrays.asList(2.0, 3.0, 3.0), tree.getRTTDist());
        assertEquals(7.0, tree.getTotalBranchLength(), EPS);

        Tree partial = NewickReader.readNewick("((A,B:2):1,C);");
        assertEquals(Arrays.asList(1.0, 3.0, 0.0), partial.getRTTDist());
        assertEquals(3.0, partial.getTotalBranchLength(), EPS);
    }

    @Test
    public void testMRCA() {
        Tree tree = NewickReader.readNewick("((A:1,B:2):1,C:3);");
        Node a = tree.getNodeByLabel("A");
        Node b = tree.getNodeByLabel("B");

        assertSame(tree.getRoot(), tree.getMRCA(tree.getLeafList()));
        assertSame(tree.getNode(1), tree.getMRCA(Arrays.asList(a, b)));
        assertSame(tree.getNode(1), tree.getMRCA(Collections.singletonList(a)));
        assertSame(tree.getRoot(), tree.getMRCA(Collections.singletonList(tree.getRoot())));
        assertNull(tree.getMRCA(Collections.emptyList()));

        Tree other = NewickReader.readNewick("((A:1,B:2):1,C:3);");
        assertNull(tree.getMRCA(Arrays.asList(a, other.getNodeByLabel("B"))));
    }

    @Test
    public void testLadderise() {
        Tree tree = NewickReader.readNewick("((A,(B,C)),D);");
        tree.ladderise();
        assertEquals("(D,(A,(B,C))):0.0;", NewickWriter.write(tree));
        assertEquals(Arrays.asList("D", "A", "B", "C"), tree.getTipLabels());

        tree.ladderise();
        assertEquals("(D,(A,(B,C))):0.0;", NewickWriter.write(tree));
    }

    @Test
    public void testLadderiseKeepsOrderOfTies() {
        Tree tree = NewickReader.readNewick("((B,C),(D,E),A);");
        tree.ladderise();
        assertEquals("(A,(B,C),(D,E)):0.0;", NewickWriter.write(tree));
    }

    @Test
    public void testLadderiseKeepsHeights() {
        Tree tree = NewickReader.readNewick("((A:1,B:2):1,C:3);");
        tree.ladderise();
        assertEquals(3.0, tree.getRoot().getHeight(), EPS);
        assertEquals(2.0, tree.getRoot().getChild(1).getHeight(), EPS);
    }

    @Test
    public void testRecombEdgeMap() {
        Tree tree = NewickReader.readNewick("((A,(B)#H1),(C,#H1));");
        Map<Integer, List<Node>> map = tree.getRecombEdgeMap();
        assertEquals(Collections.singleton(1), map.keySet());
        List<Node> group = map.get(1);
        assertEquals(2, group.size());
        assertSame(tree.getNode(3), group.get(0));
        assertFalse(group.get(0).isLeaf());
        assertSame(tree.getNode(7), group.get(1));
        assertTrue(group.get(1).isLeaf());
        assertEquals("H", group.get(1).getHybridType());
    }

    @Test
    public void testHybridSourceWithoutDestination() {
        Tree tree = NewickReader.readNewick("((A,B)#H1,C);");
        StructuralException e = assertThrows(StructuralException.class, tree::getRecombEdgeMap);
        assertTrue(e.getMessage().contains("hybrid id 1"));
    }

    @Test
    public void testLeafOnlyHybridGroup() {
        Tree tree = NewickReader.readNewick("((A#1,B),C#1);");
        List<Node> group = tree.getRecombEdgeMap().get(1);
        assertEquals(Arrays.asList("A", "C"), Arrays.asList(group.get(0).getLabel(), group.get(1).getLabel()));
    }

    @Test
    public void testSubtree() {
        Tree tree = NewickReader.readNewick("((A:1,B:2):1,C:3);");
        Node inner = tree.getNode(1);
        Tree subtree = tree.getSubtree(inner);
        assertSame(inner, subtree.getRoot());
        assertEquals(Arrays.asList("A", "B"), subtree.getTipLabels());
        assertEquals(2.0, inner.getHeight(), EPS);
        assertEquals(0.0, subtree.getNodeByLabel("B").getHeight(), EPS);
        assertTrue(subtree.isTimeTree());
    }

    @Test
    public void testReassignNodeIDs() {
        Tree tree = NewickReader.readNewick("((A,B),C);");
        for (Node node : tree.getNodeList()) {
            node.setId(node.getId() + 10);
        }
        tree.reassignNodeIDs();
        assertEquals("A", tree.getNode(2).getLabel());
        assertEquals("C", tree.getNodeByLabel("C").getLabel());
    }
}
