/**
 * Copyright (c) 2026, the open-qcircuit contributors
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package org.openqc.circuit.graph;

import com.powsybl.commons.PowsyblException;
import org.jgrapht.Graph;
import org.jgrapht.Graphs;
import org.jgrapht.graph.Pseudograph;
import org.openqc.circuit.network.Branch;
import org.openqc.circuit.network.BranchType;
import org.openqc.circuit.network.CircuitNetwork;
import org.openqc.circuit.network.Node;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Spanning tree of the inductive part of the circuit, after capacitors and shorted branches are removed and
 * dangling nodes are pruned. Nodes are grouped in generations by breadth-first distance from the root (ground
 * when present). Branches of the pruned graph that are not in the tree close one loop each.
 *
 * @author open-qcircuit contributors
 */
public final class SpanningTree {

    private static final Logger LOGGER = LoggerFactory.getLogger(SpanningTree.class);

    private final List<Branch> treeBranches;

    private final List<Branch> loopBranches;

    private final List<List<Node>> generations;

    private SpanningTree(List<Branch> treeBranches, List<Branch> loopBranches, List<List<Node>> generations) {
        this.treeBranches = List.copyOf(treeBranches);
        this.loopBranches = List.copyOf(loopBranches);
        this.generations = generations.stream().map(List::copyOf).toList();
    }

    public static SpanningTree build(CircuitNetwork network) {
        Objects.requireNonNull(network);
        Map<String, Integer> positions = new HashMap<>();
        Graph<Integer, String> graph = new Pseudograph<>(String.class);
        for (Node node : network.getAllNodes()) {
            graph.addVertex(node.getIndex());
        }
        for (Branch branch : network.getBranches()) {
            positions.put(branch.getId(), positions.size());
            if (branch.getType() != BranchType.CAPACITOR && !branch.isShorted()) {
                graph.addEdge(branch.getNode1().getIndex(), branch.getNode2().getIndex(), branch.getId());
            }
        }

        prune(network, graph);
        boolean hasNode = network.getNodes().stream().anyMatch(n -> graph.containsVertex(n.getIndex()));
        if (!hasNode) {
            LOGGER.debug("No inductive loop left after pruning, spanning tree is empty");
            return new SpanningTree(List.of(), List.of(), List.of());
        }

        List<List<Integer>> generations = buildGenerations(network, graph);
        Comparator<String> byPosition = Comparator.comparing(positions::get);

        List<String> treeIds = new ArrayList<>();
        for (int g = 1; g < generations.size(); g++) {
            for (int index : generations.get(g)) {
                for (int previous : generations.get(g - 1)) {
                    Optional<String> edge = graph.getAllEdges(index, previous).stream().min(byPosition);
                    if (edge.isPresent()) {
                        treeIds.add(edge.get());
                        break;
                    }
                }
            }
        }
        List<String> loopIds = graph.edgeSet().stream().sorted(byPosition).toList();

        SpanningTree tree = new SpanningTree(
                treeIds.stream().map(network::getBranch).toList(),
                loopIds.stream().map(network::getBranch).toList(),
                generations.stream().map(gen -> gen.stream().map(network::getNode).toList()).toList());
        LOGGER.debug("Spanning tree: {} tree branches, {} loop branches, {} generations",
                tree.treeBranches.size(), tree.loopBranches.size(), tree.generations.size());
        return tree;
    }

    /**
     * Iteratively remove non-ground nodes with at most one remaining branch.
     */
    private static void prune(CircuitNetwork network, Graph<Integer, String> graph) {
        boolean pruned = true;
        while (pruned) {
            pruned = false;
            for (Node node : network.getNodes()) {
                int index = node.getIndex();
                if (graph.containsVertex(index) && graph.degreeOf(index) <= 1) {
                    graph.removeVertex(index);
                    pruned = true;
                }
            }
        }
    }

    private static List<List<Integer>> buildGenerations(CircuitNetwork network, Graph<Integer, String> graph) {
        SortedSet<Integer> remaining = new TreeSet<>(graph.vertexSet());
        int root = network.isGrounded() ? 0 : remaining.first();
        List<List<Integer>> generations = new ArrayList<>();
        generations.add(new ArrayList<>(List.of(root)));
        Set<Integer> visited = new HashSet<>(List.of(root));
        while (visited.size() < remaining.size()) {
            List<Integer> current = generations.get(generations.size() - 1);
            if (current.isEmpty()) {
                // disconnected piece: seed it with its lowest index node
                int seed = remaining.stream().filter(i -> !visited.contains(i)).findFirst().orElseThrow();
                current.add(seed);
                visited.add(seed);
            }
            SortedSet<Integer> next = new TreeSet<>();
            for (int index : current) {
                for (String edge : graph.edgesOf(index)) {
                    int neighbor = Graphs.getOppositeVertex(graph, edge, index);
                    if (!visited.contains(neighbor)) {
                        next.add(neighbor);
                    }
                }
            }
            visited.addAll(next);
            generations.add(new ArrayList<>(next));
        }
        return generations;
    }

    public List<Branch> getTreeBranches() {
        return treeBranches;
    }

    /**
     * Branches of the pruned graph, tree branches included, in circuit order.
     */
    public List<Branch> getLoopBranches() {
        return loopBranches;
    }

    public List<List<Node>> getGenerations() {
        return generations;
    }

    public boolean isEmpty() {
        return treeBranches.isEmpty();
    }

    /**
     * Loop branches outside the tree, one per independent loop.
     */
    public List<Branch> getClosureBranches() {
        if (treeBranches.isEmpty()) {
            return List.of();
        }
        Set<String> treeIds = treeBranches.stream().map(Branch::getId).collect(Collectors.toSet());
        return loopBranches.stream().filter(b -> !treeIds.contains(b.getId())).toList();
    }

    private int getGeneration(Node node) {
        for (int g = 0; g < generations.size(); g++) {
            for (Node n : generations.get(g)) {
                if (n.getIndex() == node.getIndex()) {
                    return g;
                }
            }
        }
        throw new PowsyblException(node + " is not part of the spanning tree");
    }

    /**
     * Tree branches leading from the root generation down to the given node, root side first.
     */
    public List<Branch> findPathToRoot(Node node) {
        int generation = getGeneration(node);
        List<Branch> path = new ArrayList<>();
        int current = node.getIndex();
        for (int g = generation - 1; g >= 0; g--) {
            Set<Integer> previous = generations.get(g).stream().map(Node::getIndex).collect(Collectors.toSet());
            for (Branch branch : treeBranches) {
                int index1 = branch.getNode1().getIndex();
                int index2 = branch.getNode2().getIndex();
                if (index2 == current && previous.contains(index1)) {
                    path.add(branch);
                    current = index1;
                    break;
                } else if (index1 == current && previous.contains(index2)) {
                    path.add(branch);
                    current = index2;
                    break;
                }
            }
        }
        Collections.reverse(path);
        return path;
    }

    /**
     * Branches of the loop closed by the given branch, ordered as a walk starting from the first of them
     * and leaving through its first node.
     */
    public List<Branch> findLoop(Branch closureBranch) {
        List<Branch> path1 = findPathToRoot(closureBranch.getNode1());
        List<Branch> path2 = findPathToRoot(closureBranch.getNode2());
        Set<String> ids1 = path1.stream().map(Branch::getId).collect(Collectors.toSet());
        Set<String> ids2 = path2.stream().map(Branch::getId).collect(Collectors.toSet());
        List<Branch> loop = new ArrayList<>();
        path1.stream().filter(b -> !ids2.contains(b.getId())).forEach(loop::add);
        path2.stream().filter(b -> !ids1.contains(b.getId())).forEach(loop::add);
        loop.add(closureBranch);
        return orderAsWalk(loop);
    }

    private static List<Branch> orderAsWalk(List<Branch> loop) {
        List<Branch> ordered = new ArrayList<>(loop.size());
        Set<String> used = new HashSet<>();
        Branch first = loop.get(0);
        ordered.add(first);
        used.add(first.getId());
        int current = first.getNode1().getIndex();
        while (ordered.size() < loop.size()) {
            Branch next = null;
            for (Branch branch : loop) {
                if (!used.contains(branch.getId())
                        && (branch.getNode1().getIndex() == current || branch.getNode2().getIndex() == current)) {
                    next = branch;
                    break;
                }
            }
            if (next == null) {
                throw new PowsyblException("Branches " + loop + " do not form a closed loop");
            }
            ordered.add(next);
            used.add(next.getId());
            current = next.getNode1().getIndex() == current ? next.getNode2().getIndex() : next.getNode1().getIndex();
        }
        return ordered;
    }
}
