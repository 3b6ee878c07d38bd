package com.landfall.manifest;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.landfall.core.model.ResourceObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Packs resource objects into the zip layout {@code kubectl apply -f manifests/} expects.
 *
 * <p>Entry {@code i} is {@code manifests/<i>.json} holding object {@code i} as canonical
 * JSON (keys sorted, compact). One unserializable object fails the whole archive.
 */
@Component
public class ManifestPackager {

    private static final Logger log = LoggerFactory.getLogger(ManifestPackager.class);

    static final String ENTRY_FORMAT = "manifests/%d.json";

    private final ObjectMapper canonicalMapper;

    public ManifestPackager() {
        this.canonicalMapper = JsonMapper.builder()
                .configure(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY, true)
                .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true)
                .build();
    }

    public ManifestArchive pack(List<? extends ResourceObject> objects) {
        var entries = new ArrayList<ManifestArchive.Entry>(objects.size());
        for (int i = 0; i < objects.size(); i++) {
            var object = objects.get(i);
            entries.add(new ManifestArchive.Entry(ENTRY_FORMAT.formatted(i), toCanonicalJson(i, object)));
        }
        var archive = new ManifestArchive(entries);
        log.debug("Packed {} manifests into archive", archive.size());
        return archive;
    }

    byte[] toCanonicalJson(int index, ResourceObject object) {
        try {
            // Going through plain maps lets ORDER_MAP_ENTRIES_BY_KEYS sort JSON trees as well as beans
            Object plain = canonicalMapper.convertValue(object.body(), Object.class);
            return canonicalMapper.writeValueAsBytes(plain);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new ManifestSerializationException(
                    "marshaling json for object %d (%s/%s)".formatted(index, object.kind(), object.name()), e);
        }
    }
}
