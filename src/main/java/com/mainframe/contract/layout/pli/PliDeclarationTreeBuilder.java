package com.mainframe.contract.layout.pli;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.mainframe.contract.layout.DeclarationDiagnostics;
import com.mainframe.contract.layout.model.DeclarationModel;
import com.mainframe.contract.layout.model.DeclarationNode;
import com.mainframe.contract.layout.model.SourceStatement;

/**
 * Builds the structure trees declared with {@code DCL 1 NAME ...;} in PL/I source.
 * <p>
 * Items outside a level-1 structure are ignored. A structure ends at the item terminated by
 * {@code ;}, or when another {@code DCL} starts.
 */
public class PliDeclarationTreeBuilder {

    private static final Logger log = LoggerFactory.getLogger(PliDeclarationTreeBuilder.class);

    private static final Pattern STRUCTURE_START =
            Pattern.compile("^(?:DCL|DECLARE)\\s+0?1\\s+([A-Z0-9_#@$]+)\\s*(.*)$", Pattern.DOTALL);
    private static final Pattern DECLARE = Pattern.compile("^(?:DCL|DECLARE)\\b");
    private static final Pattern ITEM = Pattern.compile("^(\\d+)\\s+([A-Z0-9_#@$]+)\\s*(.*)$", Pattern.DOTALL);
    private static final Pattern DIMENSION = Pattern.compile("^\\(\\s*(\\d+)(?:\\s*:\\s*(\\d+))?\\s*\\)\\s*(.*)$",
            Pattern.DOTALL);

    private final PliSourceNormalizer normalizer;
    private final PliStorageClauseParser clauseParser;

    public PliDeclarationTreeBuilder() {
        this(new PliSourceNormalizer(), new PliStorageClauseParser());
    }

    public PliDeclarationTreeBuilder(PliSourceNormalizer normalizer, PliStorageClauseParser clauseParser) {
        this.normalizer = normalizer;
        this.clauseParser = clauseParser;
    }

    public DeclarationModel build(String source, String sourceName) {
        DeclarationDiagnostics diagnostics = new DeclarationDiagnostics();
        List<DeclarationNode> roots = new ArrayList<>();
        Deque<DeclarationNode> stack = new ArrayDeque<>();

        for (SourceStatement statement : normalizer.normalize(source)) {
            String text = statement.getText().toUpperCase(Locale.ROOT);
            Matcher start = STRUCTURE_START.matcher(text);
            if (start.matches()) {
                DeclarationNode root = createNode(1, start.group(1), start.group(2), statement, diagnostics, true);
                roots.add(root);
                stack.clear();
                stack.push(root);
            } else if (DECLARE.matcher(text).find()) {
                stack.clear();
            } else if (!stack.isEmpty()) {
                Matcher item = ITEM.matcher(text);
                if (item.matches()) {
                    int level = Integer.parseInt(item.group(1));
                    DeclarationNode node = createNode(level, item.group(2), item.group(3), statement, diagnostics, false);
                    while (stack.size() > 1 && stack.peek().getLevel() >= level) {
                        stack.pop();
                    }
                    if (level <= stack.peek().getLevel()) {
                        diagnostics.warn(statement.getLineNumber(), "Level " + level + " item " + node.getName()
                                + " cannot be nested under level " + stack.peek().getLevel());
                    } else {
                        stack.peek().addChild(node);
                        stack.push(node);
                    }
                } else {
                    diagnostics.warn(statement.getLineNumber(), "Malformed structure item: " + statement.getText());
                }
            }
            if (statement.isTerminated()) {
                stack.clear();
            }
        }

        log.debug("Built {} structures from {}", roots.size(), sourceName);
        return new DeclarationModel(sourceName, roots, diagnostics);
    }

    private DeclarationNode createNode(int level, String name, String rest, SourceStatement statement,
                                      DeclarationDiagnostics diagnostics, boolean root) {
        int occurs = 1;
        String attributes = rest == null ? "" : rest.trim();
        Matcher dimension = DIMENSION.matcher(attributes);
        if (dimension.matches()) {
            int low = Integer.parseInt(dimension.group(1));
            int high = dimension.group(2) != null ? Integer.parseInt(dimension.group(2)) : low;
            occurs = dimension.group(2) != null ? Math.max(1, high - low + 1) : Math.max(1, low);
            attributes = dimension.group(3).trim();
        }

        PliAttributes parsed = clauseParser.parse(attributes);
        if (!attributes.isEmpty() && !parsed.hasStorage() && parsed.getTemplateReference() == null
                && !parsed.isDefined() && !root) {
            log.debug("No storage attribute for {} at line {}: {}", name, statement.getLineNumber(), attributes);
        }
        if (parsed.isDefined() && root) {
            diagnostics.info("Structure " + name + " is DEFINED over another variable");
        }
        return DeclarationNode.builder()
                .level(level)
                .name(name)
                .occurs(occurs)
                .remainder(attributes)
                .picture(parsed.getPicture())
                .usage(parsed.getUsage())
                .templateReference(parsed.getTemplateReference())
                .redefines(parsed.isDefined() && !root)
                .value(parsed.getInitialValue())
                .description(statement.getDescription())
                .lineNumber(statement.getLineNumber())
                .build();
    }
}
