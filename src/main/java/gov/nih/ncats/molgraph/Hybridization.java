package gov.nih.ncats.molgraph;

/**
 * Bonding geometry classes used to decide how many implicit
 * hydrogens a heavy atom can carry.
 */
public enum Hybridization {
    SP3,
    SP2,
    SP1
}
