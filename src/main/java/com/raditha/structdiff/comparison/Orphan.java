package com.raditha.structdiff.comparison;

import com.raditha.structdiff.model.Change;
import com.raditha.structdiff.model.SyntaxNode;
import com.raditha.structdiff.similarity.IdentityKey;

import java.util.List;

/**
 * A node left unmatched at its level, kept with the change emitted for it and the
 * identity path of its parent. Input to the relocation pass.
 *
 * @param change     The Removed or Added change emitted for the node
 * @param node       The unmatched node
 * @param key        Identity key of the node
 * @param parentPath Identity keys from the root down to the node's parent
 * @param order      Emission order within the comparison, used for deterministic tie-breaks
 */
record Orphan(
        Change change,
        SyntaxNode node,
        IdentityKey key,
        List<IdentityKey> parentPath,
        int order) {

    boolean sameParentAs(Orphan other) {
        return parentPath.equals(other.parentPath);
    }
}
