package org.openet.sharpen.datamodel;

import org.openet.sharpen.core.MisalignedGridException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * An ordered set of named bands sharing one {@link RasterGrid}, together with the scene metadata.
 *
 * @author openet
 * @version $Revision: $ $Date: $
 */
public class RasterImage {

    private final String name;
    private final RasterGrid grid;
    private final SceneMetadata metadata;
    private final Map<String, RasterBand> bands;

    public RasterImage(String name, RasterGrid grid, SceneMetadata metadata) {
        this.name = name;
        this.grid = grid;
        this.metadata = metadata;
        this.bands = new LinkedHashMap<String, RasterBand>();
    }

    public String getName() {
        return name;
    }

    public RasterGrid getGrid() {
        return grid;
    }

    public SceneMetadata getMetadata() {
        return metadata;
    }

    public int getWidth() {
        return grid.getWidth();
    }

    public int getHeight() {
        return grid.getHeight();
    }

    /**
     * Adds a band. A band with the same name is replaced.
     *
     * @throws MisalignedGridException if the band is not on the grid of this image
     */
    public RasterBand addBand(RasterBand band) throws MisalignedGridException {
        if (!grid.equals(band.getGrid())) {
            throw new MisalignedGridException("Band " + band.getName() + " is on " + band.getGrid() +
                                              ", image " + name + " is on " + grid);
        }
        bands.put(band.getName(), band);
        return band;
    }

    public RasterBand addBand(String bandName, double[] samples) {
        return addBand(RasterBand.wrap(bandName, grid, samples));
    }

    public RasterBand getBand(String bandName) {
        return bands.get(bandName);
    }

    public boolean containsBand(String bandName) {
        return bands.containsKey(bandName);
    }

    public int getNumBands() {
        return bands.size();
    }

    public List<RasterBand> getBands() {
        return new ArrayList<RasterBand>(bands.values());
    }

    public String[] getBandNames() {
        return bands.keySet().toArray(new String[bands.size()]);
    }

    @Override
    public String toString() {
        return "RasterImage[" + name + ", " + bands.keySet() + ", " + grid + "]";
    }
}
