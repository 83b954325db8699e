package com.mainframe.contract.layout.model;

import java.util.ArrayList;
import java.util.List;

import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * One declared item of a structure (COBOL level entry or PL/I structure item).
 * A node is elementary when it carries storage, otherwise it is a group.
 */
@Data
@Builder
public class DeclarationNode {

    private int level;
    private String name;
    @Builder.Default
    private int occurs = 1;
    private String remainder;
    private String picture;
    private UsageType usage;
    private boolean redefines;
    private String templateReference;
    private String value;
    private String description;
    private int lineNumber;

    @Builder.Default
    private List<DeclarationNode> children = new ArrayList<>();

    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private DeclarationNode parent;

    public void addChild(DeclarationNode child) {
        child.setParent(this);
        children.add(child);
    }

    public boolean isElementary() {
        if (picture != null && !picture.isBlank()) {
            return true;
        }
        return usage != null && usage.isFloating();
    }

    public boolean hasTemplateReference() {
        return templateReference != null && !templateReference.isBlank();
    }

    public boolean isGroup() {
        return !isElementary() && !hasTemplateReference();
    }

    /**
     * Depth-first search for a descendant with the given name.
     */
    public DeclarationNode findDescendant(String descendantName) {
        for (DeclarationNode child : children) {
            if (child.getName().equals(descendantName)) {
                return child;
            }
            DeclarationNode found = child.findDescendant(descendantName);
            if (found != null) {
                return found;
            }
        }
        return null;
    }
}
