package org.prossme.bpmn.autolayout;

import lombok.extern.slf4j.Slf4j;
import org.prossme.bpmn.autolayout.bpmn.BpmnHelper;
import org.prossme.bpmn.autolayout.bpmn.BpmnJsonHelper;
import org.prossme.bpmn.autolayout.bpmn.BpmnXmlWriter;
import org.prossme.bpmn.autolayout.bpmn.StructureValidator;
import org.prossme.bpmn.autolayout.bpmn.models.BpmnData;
import org.prossme.bpmn.autolayout.bpmn.models.Participant;
import org.prossme.bpmn.autolayout.bpmn.models.ProcessGraph;
import org.prossme.bpmn.autolayout.config.LayoutConfig;
import org.prossme.bpmn.autolayout.config.LayoutConfigHelper;
import org.prossme.bpmn.autolayout.di.DiagramInterchangeSerializer;
import org.prossme.bpmn.autolayout.di.DiagramMerger;
import org.prossme.bpmn.autolayout.lane.LaneInference;
import org.prossme.bpmn.autolayout.layout.GeometryLayout;
import org.prossme.bpmn.autolayout.layout.models.CollaborationLayout;
import org.prossme.bpmn.autolayout.layout.models.Layout;
import org.w3c.dom.Document;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Entry point of the engine: structure in, structure plus diagram interchange out. Instances hold
 * nothing but the immutable configuration and can be shared between threads.
 */
@Slf4j
public class BpmnAutoLayout {

    private final LayoutConfig config;

    public BpmnAutoLayout() {
        this(LayoutConfigHelper.loadDefault());
    }

    public BpmnAutoLayout(LayoutConfig config) {
        this.config = config;
    }

    public LayoutConfig getConfig() {
        return config;
    }

    /**
     * Validates the graph and computes bounds for every node and waypoints for every flow,
     * nested sub-processes included.
     *
     * @throws org.prossme.bpmn.autolayout.bpmn.StructuralException if the graph has dangling references or duplicate ids
     */
    public Layout layout(ProcessGraph graph) {
        StructureValidator.validate(graph);
        return GeometryLayout.layout(graph, config);
    }

    /**
     * The diagrams of {@code graph}, each a {@code bpmndi:BPMNDiagram} document: the main plane
     * first, then one drill-down plane per collapsed sub-process body.
     */
    public List<Document> serialize(ProcessGraph graph, Layout layout) {
        return DiagramInterchangeSerializer.serialize(graph, layout);
    }

    public CollaborationLayout layoutCollaboration(BpmnData data) {
        StructureValidator.validate(data);
        return GeometryLayout.layoutCollaboration(data, config);
    }

    /**
     * Lays out structure-only BPMN markup and returns it with diagram interchange added. Any
     * diagram already present is replaced; everything else is kept as it was.
     */
    public String addDiagram(String xml) {
        BpmnData data = BpmnHelper.parseBpmn(xml);
        StructureValidator.validate(data);

        String result = DiagramMerger.merge(xml, diagramsFor(data));
        log.info("Added diagram to definitions '{}': {} process(es), {} -> {} chars",
                data.id(), data.processes().size(), xml.length(), result.length());
        return result;
    }

    /**
     * Same as {@link #addDiagram} for the JSON structure format. The structural markup is generated,
     * with inferred lane membership written into the lanes.
     */
    public String addDiagramFromJson(String json) {
        BpmnData parsed = BpmnJsonHelper.parseJson(json);
        StructureValidator.validate(parsed);

        List<ProcessGraph> resolved = new ArrayList<>();
        parsed.processes().forEach(process -> resolved.add(LaneInference.resolveLanes(process)));
        BpmnData data = parsed.withProcesses(resolved);

        String xml = BpmnXmlWriter.write(data);
        String result = DiagramMerger.merge(xml, diagramsFor(data));
        log.info("Generated definitions '{}' from JSON: {} process(es), {} chars",
                data.id(), data.processes().size(), result.length());
        return result;
    }

    private List<Document> diagramsFor(BpmnData data) {
        List<Document> diagrams = new ArrayList<>();
        Set<String> pooled = new HashSet<>();

        if (data.collaboration() != null) {
            CollaborationLayout collaborationLayout = GeometryLayout.layoutCollaboration(data, config);
            diagrams.addAll(DiagramInterchangeSerializer.serializeCollaboration(data, collaborationLayout));
            for (Participant participant : data.collaboration().participants()) {
                if (participant.processRef() != null) {
                    pooled.add(participant.processRef());
                }
            }
        }

        // processes outside any pool get a diagram of their own
        for (ProcessGraph process : data.processes()) {
            if (!pooled.contains(process.id())) {
                Layout layout = GeometryLayout.layout(process, config);
                diagrams.addAll(DiagramInterchangeSerializer.serialize(process, layout));
            }
        }
        return diagrams;
    }
}
