package com.yongkangl.phylonet.tree;

import com.yongkangl.phylonet.io.NewickReader;
import com.yongkangl.phylonet.io.NewickWriter;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class TreeRerootTest {
    private static final double EPS = 1e-12;

    private static double distance(Tree tree, Node a, Node b) {
        Node mrca = tree.getMRCA(Arrays.asList(a, b));
        return pathLength(a, mrca) + pathLength(b, mrca);
    }

    private static double pathLength(Node node, Node ancestor) {
        double length = 0.0;
        while (node != ancestor) {
            length += node.getBranchLength();
            node = node.getParent();
        }
        return length;
    }

    @Test
    public void testRerootMidpoint() {
        Tree tree = NewickReader.readNewick("((A:1,B:2):1,C:3);");
        tree.reroot(tree.getNodeByLabel("A"));

        assertEquals("(A:0.5,(B:2,C:4):0.5):0.0;", NewickWriter.write(tree));
        assertEquals(7.0, tree.getTotalBranchLength(), EPS);
        assertNull(tree.getRoot().getBranchLength());

        Node a = tree.getNodeByLabel("A");
        Node b = tree.getNodeByLabel("B");
        Node c = tree.getNodeByLabel("C");
        assertEquals(3.0, distance(tree, a, b), EPS);
        assertEquals(5.0, distance(tree, a, c), EPS);
        assertEquals(6.0, distance(tree, b, c), EPS);
    }

    @Test
    public void testRerootRenumbersAndRecomputesHeights() {
        Tree tree = NewickReader.readNewick("((A:1,B:2):1,C:3);");
        tree.reroot(tree.getNodeByLabel("A"));

        assertEquals(0, tree.getRoot().getId());
        assertEquals(1, tree.getNodeByLabel("A").getId());
        assertEquals(3, tree.getNodeByLabel("B").getId());
        assertEquals(4, tree.getNodeByLabel("C").getId());
        assertEquals(4.5, tree.getRoot().getHeight(), EPS);
        assertEquals(4.0, tree.getNode(2).getHeight(), EPS);
        assertEquals(2.0, tree.getNodeByLabel("B").getHeight(), EPS);
        assertEquals(0.0, tree.getNodeByLabel("C").getHeight(), EPS);
        assertTrue(tree.isTimeTree());
    }

    @Test
    public void testRerootWithProportion() {
        Tree tree = NewickReader.readNewick("((A:1,B:2):1,C:3);");
        tree.reroot(tree.getNodeByLabel("A"), 0.25);
        assertEquals("(A:0.25,(B:2,C:4):0.75):0.0;", NewickWriter.write(tree));
    }

    @Test
    public void testRerootOutOfRangeProportionSplitsInHalf() {
        Tree tree = NewickReader.readNewick("((A:1,B:2):1,C:3);");
        tree.reroot(tree.getNodeByLabel("A"), 1.5);
        assertEquals("(A:0.5,(B:2,C:4):0.5):0.0;", NewickWriter.write(tree));
    }

    @Test
    public void testRerootBelowRoot() {
        Tree tree = NewickReader.readNewick("((A:1,B:2):1,C:3);");
        tree.reroot(tree.getNodeByLabel("C"));
        assertEquals("(C:1.5,(A:1,B:2):2.5):0.0;", NewickWriter.write(tree));
    }

    @Test
    public void testRerootAtRootFails() {
        Tree tree = NewickReader.readNewick("((A:1,B:2):1,C:3);");
        String before = NewickWriter.write(tree);
        assertThrows(StructuralException.class, () -> tree.reroot(tree.getRoot()));
        assertEquals(before, NewickWriter.write(tree));
    }

    @Test
    public void testRerootWithoutBranchLengths() {
        Tree tree = NewickReader.readNewick("((A,B),C);");
        tree.reroot(tree.getNodeByLabel("A"));
        assertEquals("(A,(B,C)):0.0;", NewickWriter.write(tree));
        assertFalse(tree.isTimeTree());
    }

    @Test
    public void testRerootNetworkOutsideReticulation() {
        Tree tree = NewickReader.readNewick("((A:1,(B:1)#H1:1):1,(C:1,#H1:1):1);");
        tree.reroot(tree.getNodeByLabel("A"));

        assertEquals("(A:0.5,((B:1)#H1:1,(C:1,#H1:-1):2):0.5):0.0;", NewickWriter.write(tree));

        List<Node> group = tree.getRecombEdgeMap().get(1);
        assertEquals(2, group.size());
        assertEquals(group.get(0).getHeight(), group.get(1).getHeight(), EPS);
        assertEquals(2.0, group.get(0).getHeight(), EPS);
    }

    @Test
    public void testRerootInsideReticulation() {
        Tree tree = NewickReader.readNewick("((A:1,(B:1)#H1:1):1,(C:1,#H1:1):1);");
        tree.reroot(tree.getNodeByLabel("B"));

        assertEquals("(B:0.5,((A:1,#0:1):1,(C:1,#0:1):1):0.5):0.0;", NewickWriter.write(tree));
        assertEquals(7.0, tree.getTotalBranchLength(), EPS);

        Map<Integer, List<Node>> map = tree.getRecombEdgeMap();
        assertEquals(new HashSet<>(Arrays.asList(0)), map.keySet());
        for (Node node : map.get(0)) {
            assertTrue(node.isLeaf());
        }

        Node b = tree.getNodeByLabel("B");
        assertFalse(b.isHybrid());
        assertEquals(new HashSet<>(Arrays.asList("A", "B", "C")), labelledTips(tree));
    }

    @Test
    public void testFailedRerootLeavesTreeUnchanged() {
        Tree tree = NewickReader.readNewick("((A:1,B:1):1,C);");
        String before = NewickWriter.write(tree);
        Node root = tree.getRoot();
        Node a = tree.getNodeByLabel("A");

        StructuralException e = assertThrows(StructuralException.class, () -> tree.reroot(a));
        assertTrue(e.getMessage().startsWith("Cannot merge"));

        assertSame(root, tree.getRoot());
        assertNull(root.getParent());
        assertSame(tree.getRoot(), tree.getNodeList().get(0));
        assertEquals(5, tree.getNodeList().size());
        assertEquals(before, NewickWriter.write(tree));
        assertEquals(1.0, a.getBranchLength(), EPS);
        assertEquals(2, a.getId());
        assertSame(a, tree.getNode(2));
    }

    @Test
    public void testRerootSourceWithSeveralDestinations() {
        Tree tree = NewickReader.readNewick("((A:1,(B:1)#H1:1):1,(C:1,#H1:1):1,(D:1,#H1:1):1);");
        tree.reroot(tree.getNodeByLabel("B"));

        assertEquals("(B:0.5,((A:1,#0:1):1,(C:1,#0:1):1,(D:1,#0:1):1):0.5):0.0;", NewickWriter.write(tree));
        assertEquals(3, tree.getRecombEdgeMap().get(0).size());
        assertGroupHeightsAgree(tree);
    }

    @Test
    public void testRerootTwoReticulations() {
        Tree tree = NewickReader.readNewick("(((A:1,(B:1)#H1:1):1,(E:1)#H2:1):1,(C:1,#H1:1,#H2:2):1);");
        tree.reroot(tree.getNodeByLabel("E"));

        assertEquals("(E:0.5,(((A:1,(B:1)#H1:1):1,#0:1):1,(C:1,#H1:1,#0:0):2):0.5):0.0;",
                NewickWriter.write(tree));
        assertEquals(new HashSet<>(Arrays.asList(0, 1)), tree.getRecombEdgeMap().keySet());
        assertGroupHeightsAgree(tree);
    }

    private static void assertGroupHeightsAgree(Tree tree) {
        for (List<Node> group : tree.getRecombEdgeMap().values()) {
            for (Node node : group) {
                assertEquals(group.get(0).getHeight(), node.getHeight(), EPS);
            }
        }
    }

    private static HashSet<String> labelledTips(Tree tree) {
        HashSet<String> labels = new HashSet<>();
        for (Node leaf : tree.getLeafList()) {
            if (leaf.getLabel() != null) {
                labels.add(leaf.getLabel());
            }
        }
        return labels;
    }
}
