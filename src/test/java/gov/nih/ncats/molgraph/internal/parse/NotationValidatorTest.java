package gov.nih.ncats.molgraph.internal.parse;

import static org.junit.Assert.*;

import org.junit.Test;

import gov.nih.ncats.molgraph.InvalidNotationException;

public class NotationValidatorTest {

	private static InvalidNotationException invalid(String notation){
		try{
			NotationValidator.validate(notation);
		}catch(InvalidNotationException e){
			return e;
		}
		fail("expected '" + notation + "' to be rejected");
		return null;
	}

	@Test
	public void wellFormedNotationsPass(){
		NotationValidator.validate("CCO");
		NotationValidator.validate("CC(=O)O");
		NotationValidator.validate("c1ccccc1");
		NotationValidator.validate("C[C@@H](Br)Cl");
		NotationValidator.validate("CC(C)(C)C#N");
		NotationValidator.validate("C1CCC2CCCCC2C1");
		NotationValidator.validate("CC(=O)[O-]");
	}

	@Test
	public void emptyNotationIsRejected(){
		assertEquals(-1, invalid("   ").getPosition());
	}

	@Test
	public void unbalancedBranchesAreRejected(){
		invalid("CC(C");
		InvalidNotationException e = invalid("CC)C");
		assertEquals(2, e.getPosition());
	}

	@Test
	public void emptyBranchIsRejected(){
		assertEquals(1, invalid("C()C").getPosition());
	}

	@Test
	public void unpairedRingDigitIsRejected(){
		invalid("C1CC");
		invalid("C1CC1CC1");
	}

	@Test
	public void unsupportedRingDigitIsRejected(){
		assertEquals(1, invalid("C7CC7").getPosition());
	}

	@Test
	public void danglingBondMarkerIsRejected(){
		assertEquals(1, invalid("C=").getPosition());
		invalid("C=(C)C");
	}

	@Test
	public void outOfAlphabetCharactersAreRejected(){
		InvalidNotationException e = invalid("CXC");
		assertEquals(1, e.getPosition());
		assertEquals("CXC", e.getNotation());
		invalid("C.C");
	}

	@Test
	public void notationMustStartWithAnAtom(){
		assertEquals(0, invalid("(C)C").getPosition());
		invalid("[Na+]");
	}

	@Test(expected = NullPointerException.class)
	public void nullNotationShouldThrowNPE(){
		NotationValidator.validate(null);
	}
}
