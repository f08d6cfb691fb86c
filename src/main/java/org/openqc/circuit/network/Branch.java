/**
 * Copyright (c) 2026, the open-qcircuit contributors
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package org.openqc.circuit.network;

import java.util.*;

/**
 * Two-terminal circuit element between {@link #getNode1()} and {@link #getNode2()}. Branches are identified
 * by their position in the circuit description.
 *
 * @author open-qcircuit contributors
 */
public abstract class Branch {

    protected final String id;

    protected final Node node1;

    protected final Node node2;

    protected Branch(String id, Node node1, Node node2) {
        this.id = Objects.requireNonNull(id);
        this.node1 = Objects.requireNonNull(node1);
        this.node2 = Objects.requireNonNull(node2);
        node1.addBranch(this);
        if (node2 != node1) {
            node2.addBranch(this);
        }
    }

    public String getId() {
        return id;
    }

    public abstract BranchType getType();

    public abstract List<BranchParameter> getParameters();

    public Node getNode1() {
        return node1;
    }

    public Node getNode2() {
        return node2;
    }

    public Node getOtherNode(Node node) {
        if (node == node1) {
            return node2;
        }
        if (node == node2) {
            return node1;
        }
        throw new IllegalArgumentException(node + " is not connected to branch " + id);
    }

    /**
     * A branch whose both terminals are the same node.
     */
    public boolean isShorted() {
        return node1 == node2;
    }

    public boolean isConnectedTo(Node node) {
        return node1 == node || node2 == node;
    }

    public boolean isConnected(Branch other) {
        return !getCommonNodes(other).isEmpty();
    }

    public Set<Node> getCommonNodes(Branch other) {
        Set<Node> common = new LinkedHashSet<>();
        for (Node node : List.of(node1, node2)) {
            if (other.isConnectedTo(node)) {
                common.add(node);
            }
        }
        return common;
    }

    public Optional<BranchParameter> getChargingEnergy() {
        return Optional.empty();
    }

    @Override
    public String toString() {
        return "Branch(" + getType().getCode() + ", " + node1.getIndex() + ", " + node2.getIndex() + ", id: " + id + ")";
    }
}
