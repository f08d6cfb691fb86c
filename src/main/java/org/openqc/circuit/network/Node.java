/**
 * Copyright (c) 2026, the open-qcircuit contributors
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package org.openqc.circuit.network;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Circuit node. Index 0 is the ground node, other nodes are numbered from 1.
 *
 * @author open-qcircuit contributors
 */
public class Node {

    private final int index;

    private final List<Branch> branches = new ArrayList<>();

    public Node(int index) {
        if (index < 0) {
            throw new IllegalArgumentException("Negative node index: " + index);
        }
        this.index = index;
    }

    public int getIndex() {
        return index;
    }

    public boolean isGround() {
        return index == 0;
    }

    void addBranch(Branch branch) {
        branches.add(Objects.requireNonNull(branch));
    }

    public List<Branch> getBranches() {
        return Collections.unmodifiableList(branches);
    }

    /**
     * Nodes reached through a branch of the given type, or of any type if null, in branch order.
     */
    public List<Node> getConnectedNodes(BranchType type) {
        List<Node> connected = new ArrayList<>();
        for (Branch branch : branches) {
            if ((type == null || branch.getType() == type) && !branch.isShorted()) {
                Node other = branch.getOtherNode(this);
                if (!connected.contains(other)) {
                    connected.add(other);
                }
            }
        }
        return connected;
    }

    public List<Node> getConnectedNodes() {
        return getConnectedNodes(null);
    }

    @Override
    public String toString() {
        return "Node(" + index + ")";
    }
}
