package org.polyfront.astvisitor;

import org.polyfront.astnode.EllipsisNode;
import org.polyfront.astnode.IdNode;
import org.polyfront.astnode.LiteralNode;
import org.polyfront.astnode.Node;
import org.polyfront.astnode.SpecialNode;
import org.polyfront.lexer.SourceInfo;

import java.util.ArrayList;
import java.util.List;

/**
 * Collects the positions of the leaves of a tree (identifiers, literals and
 * special forms) that come from real source, in traversal order. Synthesized
 * leaves with a fake info are skipped.
 */
public class SourceInfoCollector extends TraversingVisitor {
    private final List<SourceInfo> infos = new ArrayList<>();

    public static List<SourceInfo> collect(Node root) {
        SourceInfoCollector collector = new SourceInfoCollector();
        root.accept(collector);
        return collector.infos;
    }

    private void add(SourceInfo info) {
        if (info != null && !info.isFake()) {
            infos.add(info);
        }
    }

    @Override
    public void visit(IdNode node) {
        add(node.info);
    }

    @Override
    public void visit(LiteralNode node) {
        add(node.info);
    }

    @Override
    public void visit(SpecialNode node) {
        add(node.info);
    }

    @Override
    public void visit(EllipsisNode node) {
        add(node.info);
    }

    public List<SourceInfo> getInfos() {
        return infos;
    }
}
