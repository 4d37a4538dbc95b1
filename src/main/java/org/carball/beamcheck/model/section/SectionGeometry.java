package org.carball.beamcheck.model.section;

import org.carball.beamcheck.model.material.MaterialKind;

/**
 * Cross-section of the assessed member. One implementation per material; all dimensions in mm,
 * areas in mm², moduli in mm³ and second moments in mm⁴.
 */
public interface SectionGeometry {

    MaterialKind getMaterialKind();

    double getArea();

    double getElasticModulus();

    double getSecondMomentOfArea();

    double getDepth();

    /**
     * One-line description used in the calculation narrative.
     */
    String describe();
}
