package gov.nih.ncats.molgraph.internal.parse;

import static org.junit.Assert.*;

import org.junit.Test;

import gov.nih.ncats.molgraph.Element;
import gov.nih.ncats.molgraph.Molecule;

public class NotationParserTest {

	@Test
	public void linearChainIsExactlyTheDefaultChain(){
		Molecule m = NotationParser.parse("CCCC");
		double[][] expected = new double[][]{
				{0, 1, 0, 0},
				{1, 0, 1, 0},
				{0, 1, 0, 1},
				{0, 0, 1, 0}};
		double[][] actual = m.toAdjacencyMatrix();
		for(int i=0; i< 4; i++){
			assertArrayEquals(expected[i], actual[i], 0D);
		}
	}

	@Test
	public void resolvedMatrixIsSymmetricWithEmptyDiagonal(){
		double[][] full = NotationParser.parse("CC(C)(C)c1ccc(O)cc1C=O").toAdjacencyMatrix();
		for(int i=0; i< full.length; i++){
			assertEquals(0D, full[i][i], 0D);
			for(int j=0; j< full.length; j++){
				assertEquals(full[i][j], full[j][i], 0D);
			}
		}
	}

	@Test
	public void parsingIsDeterministic(){
		String notation = "CC(=O)Nc1ccc(O)cc1";
		double[][] first = NotationParser.parse(notation).toAdjacencyMatrix();
		for(int k=0; k< 5; k++){
			double[][] again = NotationParser.parse(notation).toAdjacencyMatrix();
			for(int i=0; i< first.length; i++){
				assertArrayEquals(first[i], again[i], 1E-12);
			}
		}
	}

	@Test
	public void reparsingNormalizedNotationGivesSameGraph(){
		String notation = "F/C=C/[C@@H](Cl)Br";
		String normalized = NotationNormalizer.collapse(notation)
				.replace(String.valueOf(NotationNormalizer.CHLORINE_PLACEHOLDER), "Cl")
				.replace(String.valueOf(NotationNormalizer.BROMINE_PLACEHOLDER), "Br");
		double[][] a = NotationParser.parse(notation).toAdjacencyMatrix();
		double[][] b = NotationParser.parse(normalized).toAdjacencyMatrix();
		assertEquals(a.length, b.length);
		for(int i=0; i< a.length; i++){
			assertArrayEquals(a[i], b[i], 1E-12);
		}
	}

	@Test
	public void heavyAtomsKeepWrittenOrder(){
		Molecule m = NotationParser.parse("OCC(Cl)N");
		assertEquals(Element.OXYGEN, m.getElement(0));
		assertEquals(Element.CARBON, m.getElement(1));
		assertEquals(Element.CARBON, m.getElement(2));
		assertEquals(Element.CHLORINE, m.getElement(3));
		assertEquals(Element.NITROGEN, m.getElement(4));
		assertTrue(m.hasBond(2, 4));
		assertFalse(m.hasBond(3, 4));
	}

	@Test
	public void paracetamolHeavyAtomGraph(){
		Molecule m = NotationParser.parse("CC(=O)Nc1ccc(O)cc1");
		assertEquals(11, m.getAtomCount());
		assertEquals(11, m.getBondCount());
		//the amide carbonyl is isolated from the ring by the sp3 nitrogen
		assertEquals(2D, m.getBondOrder(1, 2), 0D);
		assertEquals(1.5, m.getBondOrder(4, 5), 1E-9);
		assertEquals(1.5, m.getBondOrder(4, 10), 1E-9);
		assertEquals(1D, m.getBondOrder(7, 8), 0D);
	}
}
