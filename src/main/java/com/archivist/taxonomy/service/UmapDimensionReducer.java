package com.archivist.taxonomy.service;

import com.archivist.taxonomy.config.PipelineProperties;
import com.archivist.taxonomy.model.DocumentVector;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import tagbio.umap.Umap;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@Slf4j
@Component
public class UmapDimensionReducer implements DimensionReducer {

    private final PipelineProperties.Reduction settings;

    public UmapDimensionReducer(PipelineProperties properties) {
        this.settings = properties.reduction();
    }

    @Override
    public Map<UUID, float[]> reduce(List<DocumentVector> vectors) {
        Map<UUID, float[]> reduced = new LinkedHashMap<>();
        if (vectors.isEmpty()) {
            return reduced;
        }

        int dimensions = vectors.get(0).vector().length;
        for (DocumentVector vector : vectors) {
            if (vector.vector().length != dimensions) {
                throw new IllegalArgumentException("Mixed vector dimensions: " + dimensions + " and "
                    + vector.vector().length + " (document " + vector.documentId() + ")");
            }
        }

        // The neighbour graph needs more points than neighbours.
        if (vectors.size() <= settings.neighbours() + 1 || dimensions <= settings.targetDimensions()) {
            log.info("Skipping UMAP for {} vectors of dimension {}; using them unchanged", vectors.size(), dimensions);
            vectors.forEach(vector -> reduced.put(vector.documentId(), vector.vector()));
            return reduced;
        }

        float[][] input = new float[vectors.size()][];
        for (int i = 0; i < vectors.size(); i++) {
            input[i] = vectors.get(i).vector();
        }

        Umap umap = new Umap();
        umap.setNumberComponents(settings.targetDimensions());
        umap.setNumberNearestNeighbours(settings.neighbours());
        umap.setThreads(settings.threads());

        long started = System.currentTimeMillis();
        float[][] output = umap.fitTransform(input);
        log.info("UMAP reduced {} vectors from {} to {} dimensions in {} ms",
            vectors.size(), dimensions, settings.targetDimensions(), System.currentTimeMillis() - started);

        for (int i = 0; i < vectors.size(); i++) {
            reduced.put(vectors.get(i).documentId(), output[i]);
        }
        return reduced;
    }
}
