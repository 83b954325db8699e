package com.mainframe.contract.layout.pli;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.mainframe.contract.layout.DeclarationException;
import com.mainframe.contract.layout.FlattenOptions;
import com.mainframe.contract.layout.FlattenedLayout;
import com.mainframe.contract.layout.LayoutAnalyzer;
import com.mainframe.contract.layout.LayoutFlattener;
import com.mainframe.contract.layout.LayoutRequest;
import com.mainframe.contract.layout.StructureFilter;
import com.mainframe.contract.layout.TemplateRegistry;
import com.mainframe.contract.layout.model.DeclarationModel;
import com.mainframe.contract.layout.model.DeclarationNode;
import com.mainframe.contract.model.ContractSpec;
import com.mainframe.contract.model.RecordSpec;
import com.mainframe.contract.model.SelectorSpec;

/**
 * Contract extraction from PL/I {@code DCL 1} structures.
 * <p>
 * Field names are relative to the structure. The record name is the structure name without the
 * filter prefix that selected it, and its first characters form the selector at column 1.
 */
public class PliLayoutAnalyzer implements LayoutAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(PliLayoutAnalyzer.class);

    static final String ELEMENTARY_ROOT_FIELD = "VALUE";

    private final PliDeclarationTreeBuilder treeBuilder;

    public PliLayoutAnalyzer() {
        this(new PliDeclarationTreeBuilder());
    }

    public PliLayoutAnalyzer(PliDeclarationTreeBuilder treeBuilder) {
        this.treeBuilder = treeBuilder;
    }

    @Override
    public ContractSpec analyze(String sourceText, LayoutRequest request) {
        DeclarationModel model = treeBuilder.build(sourceText, request.getSourceName());
        StructureFilter filter = request.getFilter().normalizedWith(s -> s.toUpperCase(Locale.ROOT));
        LayoutFlattener flattener = new LayoutFlattener(new TemplateRegistry(model.getRoots()), model.getDiagnostics());

        List<RecordSpec> records = new ArrayList<>();
        Set<String> recordNames = new HashSet<>();
        for (DeclarationNode root : model.getRoots()) {
            Optional<StructureFilter.Match> match = filter.match(root.getName());
            if (!filter.isEmpty() && match.isEmpty()) {
                log.debug("Structure {} not selected", root.getName());
                continue;
            }
            String recordName = recordName(root.getName(), match.orElse(null), request.isPreserveStructureNames());
            if (!recordNames.add(recordName)) {
                model.getDiagnostics().warn(root.getLineNumber(),
                        "Structure " + root.getName() + " maps to already extracted record " + recordName);
                continue;
            }
            FlattenedLayout layout = flattener.flattenRecord(root, FlattenOptions.unqualified(ELEMENTARY_ROOT_FIELD));
            if (layout.isEmpty()) {
                model.getDiagnostics().warn(root.getLineNumber(), "Structure " + root.getName() + " has no field");
                recordNames.remove(recordName);
                continue;
            }
            int selectorLength = Math.min(Math.max(1, request.getSelectorLength()), recordName.length());
            records.add(RecordSpec.builder()
                    .name(recordName)
                    .selector(new SelectorSpec(1, selectorLength, recordName.substring(0, selectorLength)))
                    .fields(layout.toFieldSpecs())
                    .build());
        }

        model.getDiagnostics().getWarnings().forEach(w -> log.warn("{}: {}", request.getSourceName(), w));
        if (records.isEmpty()) {
            throw DeclarationException.noStructureFound(request.getSourceName());
        }

        return ContractSpec.builder()
                .sourceProgram(request.getSourceProgram())
                .lineLength(lineLength(records))
                .strictLengthValidation(request.isStrictLengthValidation())
                .recordTypes(records)
                .build();
    }

    static String recordName(String structureName, StructureFilter.Match match, boolean preserve) {
        if (match == null || match.isExact() || preserve) {
            return structureName;
        }
        String stripped = structureName.substring(match.getPrefix().length());
        return stripped.isEmpty() ? structureName : stripped;
    }

    /**
     * The common record length when all records agree, otherwise the longest record end.
     */
    static int lineLength(List<RecordSpec> records) {
        Set<Integer> sums = records.stream().map(RecordSpec::getSumOfLengths).collect(Collectors.toSet());
        if (sums.size() == 1) {
            int common = sums.iterator().next();
            int maxEnd = records.stream().mapToInt(RecordSpec::getMaxEnd).max().orElse(common);
            return Math.max(common, maxEnd);
        }
        return records.stream().mapToInt(RecordSpec::getMaxEnd).max().orElse(1);
    }
}
