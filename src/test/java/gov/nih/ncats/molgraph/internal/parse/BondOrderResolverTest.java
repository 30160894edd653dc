package gov.nih.ncats.molgraph.internal.parse;

import static org.junit.Assert.*;

import org.junit.Test;

import gov.nih.ncats.molgraph.Molecule;

public class BondOrderResolverTest {

	private static Molecule resolve(String notation){
		return ResolverTestUtil.resolve(notation, new BondOrderResolver());
	}

	@Test
	public void doubleBondMarkerGivesOrderTwo(){
		Molecule m = resolve("C=C");
		assertEquals(2D, m.getBondOrder(0, 1), 0D);
	}

	@Test
	public void tripleBondMarkerGivesOrderThree(){
		Molecule m = resolve("C#C");
		assertEquals(3D, m.getBondOrder(0, 1), 0D);
	}

	@Test
	public void onlyTheMarkedBondChanges(){
		Molecule m = resolve("CC=CC#N");
		assertEquals(1D, m.getBondOrder(0, 1), 0D);
		assertEquals(2D, m.getBondOrder(1, 2), 0D);
		assertEquals(1D, m.getBondOrder(2, 3), 0D);
		assertEquals(3D, m.getBondOrder(3, 4), 0D);
	}

	@Test
	public void markerInsideBranchTargetsBranchAtom(){
		Molecule m = resolve("CC(=O)O");
		assertEquals(2D, m.getBondOrder(1, 2), 0D);
		assertEquals(1D, m.getBondOrder(2, 3), 0D);
	}

	@Test
	public void markerAfterBranchTargetsChainBond(){
		//corrected by the branch resolver afterwards
		Molecule m = resolve("CC(C)=O");
		assertEquals(2D, m.getBondOrder(2, 3), 0D);
	}
}
