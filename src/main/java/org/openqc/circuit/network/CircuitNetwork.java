/**
 * Copyright (c) 2026, the open-qcircuit contributors
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package org.openqc.circuit.network;

import com.google.common.base.Stopwatch;
import com.powsybl.commons.PowsyblException;
import org.apache.commons.lang3.tuple.Pair;
import org.openqc.circuit.equations.Symbol;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.concurrent.TimeUnit;
import java.util.function.Predicate;

import static org.openqc.circuit.util.Markers.PERFORMANCE_MARKER;

/**
 * Circuit graph: nodes numbered 1..N, an optional ground node 0, and branches in description order.
 *
 * @author open-qcircuit contributors
 */
public class CircuitNetwork {

    private static final Logger LOGGER = LoggerFactory.getLogger(CircuitNetwork.class);

    private final List<Node> nodes;

    private final Node groundNode;

    private final List<Branch> branches;

    private final Map<String, Branch> branchesById = new HashMap<>();

    private final SymbolicParameters symbolicParameters;

    protected CircuitNetwork(List<Node> nodes, Node groundNode, List<Branch> branches, SymbolicParameters symbolicParameters) {
        this.nodes = List.copyOf(nodes);
        this.groundNode = groundNode;
        this.branches = List.copyOf(branches);
        this.symbolicParameters = Objects.requireNonNull(symbolicParameters);
        for (Branch branch : branches) {
            if (branchesById.put(branch.getId(), branch) != null) {
                throw new PowsyblException("Duplicate branch id '" + branch.getId() + "'");
            }
        }
    }

    public static CircuitNetwork create(List<BranchRecord> records) {
        return create(records, new SymbolicParameters());
    }

    /**
     * Build the circuit graph from branch records. Node indices must be 0 (ground) or form the range 1..N.
     * Every symbolic branch parameter must be defined in the given registry.
     */
    public static CircuitNetwork create(List<BranchRecord> records, SymbolicParameters symbolicParameters) {
        Objects.requireNonNull(records);
        Objects.requireNonNull(symbolicParameters);
        Stopwatch stopwatch = Stopwatch.createStarted();

        SortedMap<Integer, Node> nodesByIndex = new TreeMap<>();
        for (BranchRecord branchRecord : records) {
            validate(branchRecord, symbolicParameters);
            nodesByIndex.computeIfAbsent(branchRecord.node1(), Node::new);
            nodesByIndex.computeIfAbsent(branchRecord.node2(), Node::new);
        }
        Node groundNode = nodesByIndex.remove(0);
        int expectedIndex = 1;
        for (int index : nodesByIndex.keySet()) {
            if (index != expectedIndex) {
                throw new PowsyblException("Node indices must be consecutive from 1, missing node " + expectedIndex);
            }
            expectedIndex++;
        }

        List<Branch> branches = new ArrayList<>(records.size());
        for (BranchRecord branchRecord : records) {
            String id = Integer.toString(branches.size());
            Node node1 = branchRecord.node1() == 0 ? groundNode : nodesByIndex.get(branchRecord.node1());
            Node node2 = branchRecord.node2() == 0 ? groundNode : nodesByIndex.get(branchRecord.node2());
            List<BranchParameter> parameters = branchRecord.parameters();
            Branch branch = switch (branchRecord.type()) {
                case CAPACITOR -> new CapacitiveBranch(id, node1, node2, parameters.get(0));
                case INDUCTOR -> new InductiveBranch(id, node1, node2, parameters.get(0));
                case JUNCTION -> new JunctionBranch(id, node1, node2, parameters.get(0), parameters.get(1), false);
                case DOUBLE_JUNCTION -> new JunctionBranch(id, node1, node2, parameters.get(0), parameters.get(1), true);
            };
            if (branch.isShorted()) {
                LOGGER.warn("Branch {} is shorted on node {}", id, node1.getIndex());
            }
            branches.add(branch);
        }

        CircuitNetwork network = new CircuitNetwork(new ArrayList<>(nodesByIndex.values()), groundNode, branches, symbolicParameters);
        LOGGER.info("Circuit has {} nodes{} and {} branches", network.getNodeCount(),
                network.isGrounded() ? " plus ground" : "", branches.size());
        LOGGER.debug(PERFORMANCE_MARKER, "Circuit created in {} ms", stopwatch.elapsed(TimeUnit.MILLISECONDS));
        return network;
    }

    private static void validate(BranchRecord branchRecord, SymbolicParameters symbolicParameters) {
        BranchType type = branchRecord.type();
        if (branchRecord.parameters().size() != type.getParameterCount()) {
            throw new PowsyblException("Branch " + type.getCode() + " (" + branchRecord.node1() + ", " + branchRecord.node2()
                    + ") expects " + type.getParameterCount() + " parameters, got " + branchRecord.parameters().size());
        }
        if (branchRecord.node1() < 0 || branchRecord.node2() < 0) {
            throw new PowsyblException("Negative node index in branch " + type.getCode() + " (" + branchRecord.node1() + ", "
                    + branchRecord.node2() + ")");
        }
        for (BranchParameter parameter : branchRecord.parameters()) {
            Optional<Symbol> symbol = parameter.getSymbol();
            if (symbol.isPresent() && !symbolicParameters.isDefined(symbol.get())) {
                throw new PowsyblException("Parameter '" + symbol.get() + "' has not been initialized");
            }
        }
    }

    /**
     * Non-ground nodes sorted by index.
     */
    public List<Node> getNodes() {
        return nodes;
    }

    /**
     * Ground node, if any, followed by the other nodes.
     */
    public List<Node> getAllNodes() {
        if (groundNode == null) {
            return nodes;
        }
        List<Node> allNodes = new ArrayList<>(nodes.size() + 1);
        allNodes.add(groundNode);
        allNodes.addAll(nodes);
        return allNodes;
    }

    public int getNodeCount() {
        return nodes.size();
    }

    public Optional<Node> getGroundNode() {
        return Optional.ofNullable(groundNode);
    }

    public boolean isGrounded() {
        return groundNode != null;
    }

    public Node getNode(int index) {
        if (index == 0) {
            if (groundNode == null) {
                throw new PowsyblException("Circuit is not grounded");
            }
            return groundNode;
        }
        if (index < 1 || index > nodes.size()) {
            throw new PowsyblException("Node " + index + " not found");
        }
        return nodes.get(index - 1);
    }

    public List<Branch> getBranches() {
        return branches;
    }

    public List<Branch> getBranches(Predicate<Branch> filter) {
        return branches.stream().filter(filter).toList();
    }

    public Branch getBranch(String id) {
        Branch branch = branchesById.get(id);
        if (branch == null) {
            throw new PowsyblException("Branch '" + id + "' not found");
        }
        return branch;
    }

    public int getBranchPosition(Branch branch) {
        return branches.indexOf(getBranch(branch.getId()));
    }

    public SymbolicParameters getSymbolicParameters() {
        return symbolicParameters;
    }

    public boolean hasSymbolicParameters() {
        return !symbolicParameters.isEmpty();
    }

    /**
     * Whether the circuit is made only of capacitors and inductors.
     */
    public boolean isPurelyHarmonic() {
        return branches.stream().noneMatch(b -> b.getType().isJunction());
    }

    /**
     * Distinct node index pairs, lowest index first, joined by a junction, in branch order.
     */
    public List<Pair<Integer, Integer>> getJunctionNodePairs() {
        Set<Pair<Integer, Integer>> pairs = new LinkedHashSet<>();
        for (Branch branch : branches) {
            if (branch.getType().isJunction()) {
                int index1 = branch.getNode1().getIndex();
                int index2 = branch.getNode2().getIndex();
                pairs.add(Pair.of(Math.min(index1, index2), Math.max(index1, index2)));
            }
        }
        return new ArrayList<>(pairs);
    }

    @Override
    public String toString() {
        return "CircuitNetwork(nodes=" + nodes.size() + ", grounded=" + isGrounded() + ", branches=" + branches.size() + ")";
    }
}
