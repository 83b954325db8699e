package com.mainframe.contract.layout.cobol;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.mainframe.contract.layout.DeclarationDiagnostics;
import com.mainframe.contract.layout.DeclarationNaming;
import com.mainframe.contract.layout.model.DeclarationModel;
import com.mainframe.contract.layout.model.DeclarationNode;
import com.mainframe.contract.layout.model.SourceStatement;
import com.mainframe.contract.layout.model.UsageType;

/**
 * Builds the level hierarchy of a copybook.
 *
 * Building only:
 * - Extracts PIC, USAGE, OCCURS, REDEFINES and VALUE clauses
 * - Ignores 66, 77 and 88 items
 * - Reports malformed entries as diagnostics
 *
 * It does NOT compute byte sizes or offsets.
 */
public class CobolDeclarationTreeBuilder {

    private static final Logger log = LoggerFactory.getLogger(CobolDeclarationTreeBuilder.class);

    private static final Pattern LEVEL_ENTRY = Pattern.compile("^(\\d{1,2})(?:\\s+(.*))?$", Pattern.DOTALL);
    private static final Pattern NAME = Pattern.compile("^([A-Z0-9][A-Z0-9_-]*)(.*)$", Pattern.DOTALL);
    private static final Pattern PICTURE = Pattern.compile("\\bPIC(?:TURE)?\\s+(?:IS\\s+)?(\\S+)");
    private static final Pattern USAGE = Pattern.compile(
            "\\b(?:USAGE\\s+(?:IS\\s+)?)?(COMPUTATIONAL-[1-5]|COMP-[1-5]|COMPUTATIONAL|COMP|BINARY|PACKED-DECIMAL|DISPLAY)(?![A-Z0-9-])");
    private static final Pattern OCCURS = Pattern.compile("\\bOCCURS\\s+(\\d+)(?:\\s+TO\\s+(\\d+))?");
    private static final Pattern REDEFINES = Pattern.compile("\\bREDEFINES\\s+([A-Z0-9][A-Z0-9_-]*)");
    private static final Pattern VALUE = Pattern.compile(
            "\\bVALUES?\\s+(?:IS\\s+|ARE\\s+)?(?:'([^']*)'|\"([^\"]*)\")", Pattern.CASE_INSENSITIVE);
    private static final Pattern QUOTED = Pattern.compile("'[^']*'|\"[^\"]*\"");

    private static final Set<Integer> IGNORED_LEVELS = Set.of(66, 77, 88);
    private static final Set<String> CLAUSE_KEYWORDS = Set.of("PIC", "PICTURE", "USAGE", "VALUE", "VALUES",
            "OCCURS", "REDEFINES", "COMP", "COMP-1", "COMP-2", "COMP-3", "COMP-4", "COMP-5", "BINARY",
            "PACKED-DECIMAL", "DISPLAY", "COMPUTATIONAL");

    private final CobolSourceNormalizer normalizer;

    public CobolDeclarationTreeBuilder() {
        this(new CobolSourceNormalizer());
    }

    public CobolDeclarationTreeBuilder(CobolSourceNormalizer normalizer) {
        this.normalizer = normalizer;
    }

    public DeclarationModel build(String source, String sourceName) {
        DeclarationDiagnostics diagnostics = new DeclarationDiagnostics();
        List<DeclarationNode> roots = new ArrayList<>();
        DeclarationNode sentinel = DeclarationNode.builder().level(0).name("ROOT").build();
        Deque<DeclarationNode> stack = new ArrayDeque<>();
        stack.push(sentinel);

        for (SourceStatement statement : normalizer.normalize(source)) {
            DeclarationNode node = parseEntry(statement, diagnostics);
            if (node == null) {
                continue;
            }
            adjustStackForLevel(stack, node.getLevel());
            DeclarationNode parent = stack.peek();
            if (parent == sentinel) {
                if (node.getLevel() == 1) {
                    roots.add(node);
                } else {
                    diagnostics.warn(statement.getLineNumber(),
                            "Level " + node.getLevel() + " item " + node.getName() + " outside any 01 structure");
                    continue;
                }
            } else {
                parent.addChild(node);
            }
            stack.push(node);
        }

        log.debug("Built {} top-level structures from {}", roots.size(), sourceName);
        return new DeclarationModel(sourceName, roots, diagnostics);
    }

    private DeclarationNode parseEntry(SourceStatement statement, DeclarationDiagnostics diagnostics) {
        String text = statement.getText().toUpperCase(Locale.ROOT);
        Matcher entry = LEVEL_ENTRY.matcher(text);
        if (!entry.matches()) {
            log.debug("Ignoring non-declaration statement at line {}: {}", statement.getLineNumber(), text);
            return null;
        }
        int level = Integer.parseInt(entry.group(1));
        if (IGNORED_LEVELS.contains(level)) {
            return null;
        }
        if (level < 1 || level > 49) {
            diagnostics.warn(statement.getLineNumber(), "Invalid level number " + level);
            return null;
        }

        String body = entry.group(2) == null ? "" : entry.group(2).trim();
        String name = DeclarationNaming.FILLER;
        String remainder = body;
        Matcher nameMatcher = NAME.matcher(body);
        if (nameMatcher.matches() && !CLAUSE_KEYWORDS.contains(nameMatcher.group(1))) {
            name = DeclarationNaming.normalizeIdentifier(nameMatcher.group(1));
            remainder = nameMatcher.group(2).trim();
        } else if (!body.isEmpty() && !nameMatcher.matches()) {
            diagnostics.warn(statement.getLineNumber(), "Malformed declaration: " + statement.getText());
            return null;
        }

        String clauses = QUOTED.matcher(remainder).replaceAll("''");
        DeclarationNode.DeclarationNodeBuilder node = DeclarationNode.builder()
                .level(level)
                .name(name)
                .remainder(remainder)
                .description(statement.getDescription())
                .lineNumber(statement.getLineNumber());

        Matcher picture = PICTURE.matcher(clauses);
        if (picture.find()) {
            node.picture(picture.group(1));
        }
        Matcher usage = USAGE.matcher(clauses);
        if (usage.find()) {
            node.usage(UsageType.fromCobol(usage.group(1)));
        }
        Matcher occurs = OCCURS.matcher(clauses);
        if (occurs.find()) {
            int min = Integer.parseInt(occurs.group(1));
            int max = occurs.group(2) != null ? Integer.parseInt(occurs.group(2)) : min;
            node.occurs(Math.max(1, Math.max(min, max)));
        }
        Matcher redefines = REDEFINES.matcher(clauses);
        if (redefines.find()) {
            node.redefines(true);
            diagnostics.info("REDEFINES detected for " + name + " -> " + redefines.group(1)
                    + " at line " + statement.getLineNumber());
        }
        Matcher value = VALUE.matcher(statement.getText());
        if (value.find()) {
            node.value(value.group(1) != null ? value.group(1) : value.group(2));
        }
        return node.build();
    }

    private static void adjustStackForLevel(Deque<DeclarationNode> stack, int level) {
        while (stack.size() > 1) {
            if (stack.peek().getLevel() >= level) {
                stack.pop();
            } else {
                break;
            }
        }
    }
}
