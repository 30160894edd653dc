package gov.nih.ncats.molgraph.internal.parse;

import static org.junit.Assert.*;

import java.util.List;

import org.junit.Test;

import gov.nih.ncats.molgraph.Molecule;

public class AromaticityResolverTest {

	private static final double DELTA = 1E-9;

	private static Molecule resolve(String notation){
		return ResolverTestUtil.resolve(notation, NotationParser.getResolvers().toArray(new GraphResolver[0]));
	}

	@Test
	public void benzeneBondsAllShareOneOrderBetweenSingleAndDouble(){
		Molecule m = resolve("c1ccccc1");
		assertEquals(6, m.getBondCount());
		double first = m.getBondOrder(0, 1);
		assertTrue(first > 1 && first < 2);
		m.forEachBond((i,j,order)-> assertEquals(first, order, DELTA));
		assertEquals(1.5, first, DELTA);
	}

	@Test
	public void aromaticFlagDoesNotCreateBonds(){
		Molecule m = resolve("c1ccccc1");
		assertFalse(m.hasBond(0, 2));
		assertFalse(m.hasBond(0, 3));
	}

	@Test
	public void substituentBondOfAromaticRingIsNotBoosted(){
		Molecule m = resolve("Cc1ccccc1");
		assertEquals(1D, m.getBondOrder(0, 1), DELTA);
		assertEquals(1.5, m.getBondOrder(1, 2), DELTA);
		assertEquals(1.5, m.getBondOrder(1, 6), DELTA);
	}

	@Test
	public void butadieneIsDelocalized(){
		Molecule m = resolve("C=CC=C");
		double mean = 5D/3;
		assertEquals(mean, m.getBondOrder(0, 1), DELTA);
		assertEquals(mean, m.getBondOrder(1, 2), DELTA);
		assertEquals(mean, m.getBondOrder(2, 3), DELTA);
	}

	@Test
	public void conjugationIncludesOxygen(){
		Molecule m = resolve("C=CC=O");
		assertEquals(5D/3, m.getBondOrder(2, 3), DELTA);
	}

	@Test
	public void isolatedDoubleBondIsNotConjugated(){
		Molecule m = resolve("CC(=O)O");
		assertEquals(2D, m.getBondOrder(1, 2), DELTA);
		assertEquals(1D, m.getBondOrder(1, 3), DELTA);
		assertEquals(2D, resolve("C=C").getBondOrder(0, 1), DELTA);
	}

	@Test
	public void styreneFormsOneConjugatedSystem(){
		Molecule m = resolve("C=Cc1ccccc1");
		m.forEachBond((i,j,order)-> assertEquals(1.5, order, DELTA));
		assertEquals(8, m.getBondCount());
	}

	@Test
	public void sulfurIsBoostedButNotConjugated(){
		boolean[] aromatic = new boolean[]{true, true, true, true, true};
		Molecule m = ResolverTestUtil.resolve("c1ccsc1", new BondOrderResolver(), new BranchResolver(), new RingClosureResolver());
		AromaticityResolver.boostAromaticBonds(m, aromatic);
		assertEquals(1.5, m.getBondOrder(2, 3), DELTA);

		List<List<Integer>> systems = AromaticityResolver.findConjugatedSystems(m, aromatic);
		assertEquals(1, systems.size());
		assertEquals(4, systems.get(0).size());
		assertFalse(systems.get(0).contains(3));
	}

	@Test
	public void separatedSystemsAreAveragedIndependently(){
		Molecule m = resolve("C=CC=CCCC=CC#N");
		assertEquals(5D/3, m.getBondOrder(0, 1), DELTA);
		assertEquals(1D, m.getBondOrder(4, 5), DELTA);
		//sp3 carbons separate the second double bond from the first system
		assertEquals(2D, m.getBondOrder(6, 7), DELTA);
		assertEquals(3D, m.getBondOrder(8, 9), DELTA);
	}
}
