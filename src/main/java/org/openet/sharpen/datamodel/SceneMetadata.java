package org.openet.sharpen.datamodel;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Identity and time of a scene, carried unchanged from the source image to every derived image.
 *
 * @author openet
 * @version $Revision: $ $Date: $
 */
public class SceneMetadata {

    public static final String PROPERTY_ENERGY_CONSERVATION = "energy_conservation";

    private final String spacecraftId;
    private final String sceneId;
    private final long timeStart;
    private final Map<String, String> properties;

    public SceneMetadata(String spacecraftId, String sceneId, long timeStart) {
        this(spacecraftId, sceneId, timeStart, Collections.<String, String>emptyMap());
    }

    public SceneMetadata(String spacecraftId, String sceneId, long timeStart, Map<String, String> properties) {
        this.spacecraftId = spacecraftId;
        this.sceneId = sceneId;
        this.timeStart = timeStart;
        this.properties = Collections.unmodifiableMap(new LinkedHashMap<String, String>(properties));
    }

    public String getSpacecraftId() {
        return spacecraftId;
    }

    public String getSceneId() {
        return sceneId;
    }

    /**
     * @return the acquisition start time in milliseconds since 1970-01-01T00:00:00Z
     */
    public long getTimeStart() {
        return timeStart;
    }

    public Map<String, String> getProperties() {
        return properties;
    }

    public String getProperty(String key) {
        return properties.get(key);
    }

    public SceneMetadata withProperty(String key, String value) {
        Map<String, String> copy = new LinkedHashMap<String, String>(properties);
        copy.put(key, value);
        return new SceneMetadata(spacecraftId, sceneId, timeStart, copy);
    }

    @Override
    public String toString() {
        return "SceneMetadata[" + spacecraftId + ", " + sceneId + ", " + timeStart + ", " + properties + "]";
    }
}
