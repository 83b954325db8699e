package com.mainframe.contract.layout.cobol;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.mainframe.contract.layout.DeclarationException;
import com.mainframe.contract.layout.DeclarationNaming;
import com.mainframe.contract.layout.FlattenOptions;
import com.mainframe.contract.layout.FlattenedLayout;
import com.mainframe.contract.layout.LayoutAnalyzer;
import com.mainframe.contract.layout.LayoutField;
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
 * Contract extraction from COBOL copybooks: one record type per selected 01-level structure.
 * <p>
 * Field names are qualified with the 01-level name. The selector comes from the first field that
 * declares a {@code VALUE} literal, otherwise from the first letter of the record name at column 1.
 */
public class CobolLayoutAnalyzer implements LayoutAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(CobolLayoutAnalyzer.class);

    private final CobolDeclarationTreeBuilder treeBuilder;

    public CobolLayoutAnalyzer() {
        this(new CobolDeclarationTreeBuilder());
    }

    public CobolLayoutAnalyzer(CobolDeclarationTreeBuilder treeBuilder) {
        this.treeBuilder = treeBuilder;
    }

    @Override
    public ContractSpec analyze(String sourceText, LayoutRequest request) {
        DeclarationModel model = treeBuilder.build(sourceText, request.getSourceName());
        StructureFilter filter = request.getFilter().normalizedWith(DeclarationNaming::normalizeIdentifier);
        LayoutFlattener flattener = new LayoutFlattener(new TemplateRegistry(model.getRoots()), model.getDiagnostics());

        List<RecordSpec> records = new ArrayList<>();
        Set<String> recordNames = new HashSet<>();
        for (DeclarationNode root : model.getRoots()) {
            if (!filter.matches(root.getName())) {
                log.debug("Structure {} not selected", root.getName());
                continue;
            }
            if (!recordNames.add(root.getName())) {
                model.getDiagnostics().warn(root.getLineNumber(), "Duplicate structure " + root.getName() + " ignored");
                continue;
            }
            FlattenedLayout layout = flattener.flattenRecord(root, FlattenOptions.qualified());
            if (layout.isEmpty()) {
                model.getDiagnostics().warn(root.getLineNumber(), "Structure " + root.getName() + " has no field");
                continue;
            }
            records.add(RecordSpec.builder()
                    .name(root.getName())
                    .selector(deriveSelector(root.getName(), layout))
                    .fields(layout.toFieldSpecs())
                    .build());
        }

        model.getDiagnostics().getWarnings().forEach(w -> log.warn("{}: {}", request.getSourceName(), w));
        if (records.isEmpty()) {
            throw DeclarationException.noStructureFound(request.getSourceName());
        }

        int lineLength = records.stream().mapToInt(RecordSpec::getMaxEnd).max().orElse(1);
        boolean strict = request.isStrictLengthValidation() && records.size() == 1;
        return ContractSpec.builder()
                .sourceProgram(request.getSourceProgram())
                .lineLength(lineLength)
                .strictLengthValidation(strict)
                .recordTypes(records)
                .build();
    }

    static SelectorSpec deriveSelector(String recordName, FlattenedLayout layout) {
        Optional<LayoutField> literal = layout.firstWithValueLiteral();
        if (literal.isPresent()) {
            LayoutField field = literal.get();
            int length = Math.min(field.getValueLiteral().length(), field.getLength());
            return new SelectorSpec(field.getStart(), length, field.getValueLiteral().substring(0, length));
        }
        return new SelectorSpec(1, 1, recordName.substring(0, 1));
    }
}
