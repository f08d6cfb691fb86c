/**
 * Copyright (c) 2026, the open-qcircuit contributors
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package org.openqc.circuit.graph;

import org.jgrapht.Graph;
import org.jgrapht.alg.connectivity.ConnectivityInspector;
import org.jgrapht.graph.Pseudograph;
import org.openqc.circuit.network.Branch;
import org.openqc.circuit.network.CircuitNetwork;
import org.openqc.circuit.network.Node;
import org.openqc.circuit.util.MatrixUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Derives node-space vectors from the connected components a subset of branches forms on the circuit nodes.
 * <p>
 * Each component that does not touch ground yields a vector with {@code inValue} on its nodes and
 * {@code outValue} elsewhere, and so does the group of nodes no branch of the subset touches. Optionally each
 * of these untouched nodes also yields its own vector, kept only if it is independent from the ones already
 * found. Vectors span the non-ground nodes, ordered by index.
 *
 * @author open-qcircuit contributors
 */
public class ModeExtractor {

    private static final Logger LOGGER = LoggerFactory.getLogger(ModeExtractor.class);

    private static final int GROUNDED = -1;

    private static final int UNTOUCHED = 0;

    private final CircuitNetwork network;

    public ModeExtractor(CircuitNetwork network) {
        this.network = Objects.requireNonNull(network);
    }

    public List<double[]> extract(List<Branch> branchSubset, boolean singleNodes) {
        return extract(branchSubset, singleNodes, 1, 0);
    }

    public List<double[]> extract(List<Branch> branchSubset, boolean singleNodes, double inValue, double outValue) {
        int size = network.getNodeCount() + (network.isGrounded() ? 1 : 0);
        // ground, when present, takes the last position
        int[] markers = new int[size];
        if (network.isGrounded()) {
            markers[size - 1] = GROUNDED;
        }

        Graph<Node, Branch> graph = new Pseudograph<>(Branch.class);
        for (Branch branch : branchSubset) {
            graph.addVertex(branch.getNode1());
            graph.addVertex(branch.getNode2());
            graph.addEdge(branch.getNode1(), branch.getNode2(), branch);
        }
        ConnectivityInspector<Node, Branch> inspector = new ConnectivityInspector<>(graph);
        Set<Node> marked = new HashSet<>();
        int componentCount = 0;
        for (Branch branch : branchSubset) {
            if (marked.contains(branch.getNode1())) {
                continue;
            }
            Set<Node> component = inspector.connectedSetOf(branch.getNode1());
            componentCount++;
            int marker = component.stream().anyMatch(Node::isGround) ? GROUNDED : componentCount;
            for (Node node : component) {
                markers[position(node, size)] = marker;
                marked.add(node);
            }
        }

        SortedSet<Integer> distinctMarkers = new TreeSet<>();
        for (int marker : markers) {
            if (marker != GROUNDED) {
                distinctMarkers.add(marker);
            }
        }
        List<double[]> vectors = new ArrayList<>();
        for (int marker : distinctMarkers) {
            double[] vector = new double[size];
            for (int i = 0; i < size; i++) {
                vector[i] = markers[i] == marker ? inValue : outValue;
            }
            vectors.add(vector);
        }

        if (singleNodes) {
            for (int i = 0; i < size; i++) {
                if (markers[i] == UNTOUCHED) {
                    double[] vector = new double[size];
                    Arrays.fill(vector, outValue);
                    vector[i] = inValue;
                    if (MatrixUtil.increasesRank(vectors, vector)) {
                        vectors.add(vector);
                    }
                }
            }
        }

        List<double[]> result = new ArrayList<>(vectors.size());
        for (double[] vector : vectors) {
            result.add(network.isGrounded() ? Arrays.copyOf(vector, size - 1) : vector);
        }
        LOGGER.trace("{} vectors from {} branches forming {} components", result.size(), branchSubset.size(), componentCount);
        return result;
    }

    private static int position(Node node, int size) {
        return node.isGround() ? size - 1 : node.getIndex() - 1;
    }
}
