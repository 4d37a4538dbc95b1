package org.carball.beamcheck.model.section;

/**
 * One layer of tension reinforcement. Cover is measured from the tension face to the face of
 * the bar, in mm.
 */
public record ReinforcementLayer(int barCount, double barDiameter, double cover) {

    public double getBarArea() {
        return Math.PI * barDiameter * barDiameter / 4.0;
    }

    public double getSteelArea() {
        return barCount * getBarArea();
    }

    /**
     * Distance from the tension face to the bar centroid.
     */
    public double getCentroidDistance() {
        return cover + barDiameter / 2.0;
    }
}
