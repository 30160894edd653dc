package gov.nih.ncats.molgraph.internal.parse;

import static org.junit.Assert.*;

import org.junit.Test;

import gov.nih.ncats.molgraph.Molecule;

public class ChainBuilderTest {

	@Test
	public void chainBondsEveryAtomToTheNextOne(){
		Molecule m = ChainBuilder.buildChain(NotationNormalizer.normalize("CCCC"));
		assertEquals(4, m.getAtomCount());
		assertEquals(3, m.getBondCount());
		for(int i=0; i< 3; i++){
			assertEquals(1D, m.getBondOrder(i, i+1), 0D);
		}
		assertFalse(m.hasBond(0, 2));
		assertFalse(m.hasBond(0, 3));
	}

	@Test
	public void chainIgnoresTopologyCharacters(){
		Molecule m = ChainBuilder.buildChain(NotationNormalizer.normalize("C1CC(=O)C1"));
		assertEquals(5, m.getAtomCount());
		assertEquals(4, m.getBondCount());
		assertEquals(1D, m.getBondOrder(2, 3), 0D);
	}

	@Test
	public void singleAtomHasNoBonds(){
		Molecule m = ChainBuilder.buildChain(NotationNormalizer.normalize("C"));
		assertEquals(1, m.getAtomCount());
		assertEquals(0, m.getBondCount());
	}

	@Test
	public void contextHoldsNotationAndIndex(){
		NormalizedNotation n = NotationNormalizer.normalize("C=C");
		ParseContext context = ChainBuilder.indexTopology(n);
		assertSame(n, context.getNotation());
		assertEquals(1, context.getTopologyIndex().size());
	}
}
