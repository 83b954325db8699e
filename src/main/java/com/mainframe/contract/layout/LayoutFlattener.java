package com.mainframe.contract.layout;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.mainframe.contract.layout.model.DeclarationNode;
import com.mainframe.contract.layout.model.PictureClause;
import com.mainframe.contract.layout.model.StorageLayout;

/**
 * Walks a declaration tree depth-first and assigns every elementary item its 1-based byte range.
 * <p>
 * Each step receives the cursor and returns the advanced one. Redefinitions consume nothing;
 * template references clone the memoized relative layout of the referenced group.
 */
public class LayoutFlattener {

    private static final Logger log = LoggerFactory.getLogger(LayoutFlattener.class);

    private static final String DESCRIPTION_SEPARATOR = " | ";

    private final TemplateRegistry templates;
    private final DeclarationDiagnostics diagnostics;

    public LayoutFlattener(TemplateRegistry templates, DeclarationDiagnostics diagnostics) {
        this.templates = templates;
        this.diagnostics = diagnostics;
    }

    public FlattenedLayout flattenRecord(DeclarationNode root, FlattenOptions options) {
        FieldSink sink = new FieldSink(new FieldNameAllocator());
        String structure = root.getName();
        int cursor;
        if (!root.isGroup()) {
            String name = options.getElementaryRootName() != null ? options.getElementaryRootName() : root.getName();
            cursor = emit(root, name, "", null, 1, structure, sink);
        } else {
            String prefix = options.isQualifyWithRootName() ? root.getName() : "";
            cursor = 1;
            for (DeclarationNode child : root.getChildren()) {
                cursor = emit(child, child.getName(), prefix, root.getDescription(), cursor, structure, sink);
            }
        }
        log.debug("Flattened {} into {} fields, {} bytes", structure, sink.fields.size(), cursor - 1);
        return new FlattenedLayout(sink.fields, cursor - 1);
    }

    private int emit(DeclarationNode node, String nodeName, String prefix, String inheritedDescription,
                     int position, String structure, FieldSink sink) {
        if (node.isRedefines()) {
            log.debug("Skipping redefinition {} at position {}", node.getName(), position);
            return position;
        }
        String qualified = DeclarationNaming.qualify(prefix, nodeName);
        String description = joinDescriptions(inheritedDescription, node.getDescription());
        int occurs = Math.max(1, node.getOccurs());
        int cursor = position;

        if (node.hasTemplateReference()) {
            Optional<GroupTemplate> template = resolveTemplate(node, structure);
            if (template.isEmpty()) {
                return position;
            }
            for (int i = 1; i <= occurs; i++) {
                String target = DeclarationNaming.indexed(qualified, i, occurs);
                for (LayoutField field : template.get().getFields()) {
                    sink.add(DeclarationNaming.qualify(target, field.getName()), cursor + field.getStart() - 1,
                            field.getStorage(), joinDescriptions(description, field.getDescription()),
                            field.getValueLiteral());
                }
                cursor += template.get().getLength();
            }
            return cursor;
        }

        if (node.isElementary()) {
            StorageLayout storage = PictureClause.evaluate(node.getPicture(), node.getUsage());
            if (storage == null) {
                diagnostics.warn(node.getLineNumber(),
                        "Unrecognized storage for " + node.getName() + ": " + node.getPicture());
                return position;
            }
            for (int i = 1; i <= occurs; i++) {
                sink.add(DeclarationNaming.indexed(qualified, i, occurs), cursor, storage, description, node.getValue());
                cursor += storage.getLength();
            }
            return cursor;
        }

        for (int i = 1; i <= occurs; i++) {
            String groupPrefix = DeclarationNaming.indexed(qualified, i, occurs);
            for (DeclarationNode child : node.getChildren()) {
                cursor = emit(child, child.getName(), groupPrefix, description, cursor, structure, sink);
            }
        }
        return cursor;
    }

    private Optional<GroupTemplate> resolveTemplate(DeclarationNode node, String structure) {
        Optional<TemplateRegistry.Target> target = templates.locate(node.getTemplateReference(), structure);
        if (target.isEmpty()) {
            diagnostics.warn(node.getLineNumber(),
                    "Unresolved template reference " + node.getTemplateReference() + " for " + node.getName());
            return Optional.empty();
        }
        return Optional.of(templates.resolve(target.get(), this::buildTemplate));
    }

    private GroupTemplate buildTemplate(TemplateRegistry.Target target) {
        FieldSink sink = new FieldSink(null);
        DeclarationNode node = target.getNode();
        int cursor = 1;
        if (node.hasTemplateReference() || node.isElementary()) {
            DeclarationNode single = DeclarationNode.builder()
                    .level(node.getLevel())
                    .name(node.getName())
                    .picture(node.getPicture())
                    .usage(node.getUsage())
                    .templateReference(node.getTemplateReference())
                    .lineNumber(node.getLineNumber())
                    .build();
            cursor = emit(single, "", "", null, cursor, target.getStructureName(), sink);
        } else {
            for (DeclarationNode child : node.getChildren()) {
                cursor = emit(child, child.getName(), "", null, cursor, target.getStructureName(), sink);
            }
        }
        log.debug("Built template {} ({} fields, {} bytes)", target.getKey(), sink.fields.size(), cursor - 1);
        return new GroupTemplate(target.getKey(), List.copyOf(sink.fields), cursor - 1);
    }

    static String joinDescriptions(String inherited, String own) {
        boolean hasInherited = inherited != null && !inherited.isBlank();
        boolean hasOwn = own != null && !own.isBlank();
        if (hasInherited && hasOwn) {
            return inherited + DESCRIPTION_SEPARATOR + own.trim();
        }
        if (hasOwn) {
            return own.trim();
        }
        return hasInherited ? inherited : null;
    }

    /**
     * Collects emitted fields. Record-level sinks make names unique; template sinks keep relative names as-is.
     */
    private static final class FieldSink {
        private final FieldNameAllocator allocator;
        private final List<LayoutField> fields = new ArrayList<>();

        private FieldSink(FieldNameAllocator allocator) {
            this.allocator = allocator;
        }

        void add(String name, int start, StorageLayout storage, String description, String valueLiteral) {
            String unique = allocator == null ? name : allocator.allocate(name);
            fields.add(new LayoutField(unique, start, storage, description, valueLiteral));
        }
    }
}
