package org.openet.sharpen.landsat;

import org.openet.sharpen.core.SharpeningException;

/**
 * Per spacecraft constants: the resolution the thermal band is aggregated to, the window of the
 * energy conservation step (both in metres, scaling with the point spread of the thermal sensor)
 * and the Collection 2 Level 2 band names.
 *
 * @author openet
 * @version $Revision: $ $Date: $
 */
public enum SensorProfile {

    LANDSAT_4(120, 120, new String[]{"SR_B1", "SR_B2", "SR_B3", "SR_B4", "SR_B5", "SR_B7"}, "ST_B6"),
    LANDSAT_5(120, 120, new String[]{"SR_B1", "SR_B2", "SR_B3", "SR_B4", "SR_B5", "SR_B7"}, "ST_B6"),
    LANDSAT_7(60, 90, new String[]{"SR_B1", "SR_B2", "SR_B3", "SR_B4", "SR_B5", "SR_B7"}, "ST_B6"),
    LANDSAT_8(100, 120, new String[]{"SR_B2", "SR_B3", "SR_B4", "SR_B5", "SR_B6", "SR_B7"}, "ST_B10"),
    LANDSAT_9(100, 120, new String[]{"SR_B2", "SR_B3", "SR_B4", "SR_B5", "SR_B6", "SR_B7"}, "ST_B10");

    public final double tirResolution;
    public final double ecWindow;
    private final String[] reflectanceBandNames;
    private final String thermalBandName;

    private SensorProfile(double tirResolution, double ecWindow, String[] reflectanceBandNames,
                          String thermalBandName) {
        if (!(tirResolution > 0.0)) {
            throw new IllegalStateException(name() + ": invalid thermal resolution " + tirResolution);
        }
        if (!(ecWindow >= tirResolution)) {
            throw new IllegalStateException(name() + ": energy conservation window " + ecWindow +
                                            " is smaller than the thermal resolution " + tirResolution);
        }
        this.tirResolution = tirResolution;
        this.ecWindow = ecWindow;
        this.reflectanceBandNames = reflectanceBandNames;
        this.thermalBandName = thermalBandName;
    }

    /**
     * @return the Collection 2 surface reflectance band names, ordered like the predictor bands
     */
    public String[] getReflectanceBandNames() {
        return reflectanceBandNames.clone();
    }

    public String getThermalBandName() {
        return thermalBandName;
    }

    /**
     * @param spacecraftId a spacecraft identifier such as {@code LANDSAT_8}
     * @return the profile of the spacecraft
     * @throws SharpeningException if the spacecraft is not supported
     */
    public static SensorProfile forSpacecraftId(String spacecraftId) throws SharpeningException {
        if (spacecraftId == null) {
            throw new SharpeningException("Scene has no spacecraft identifier");
        }
        for (SensorProfile profile : values()) {
            if (profile.name().equalsIgnoreCase(spacecraftId.trim())) {
                return profile;
            }
        }
        throw new SharpeningException("Unsupported spacecraft: " + spacecraftId);
    }
}
