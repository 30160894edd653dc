package gov.nih.ncats.molgraph;

import static org.junit.Assert.*;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

public class MainTest {

	@Rule
	public TemporaryFolder tmpDir = new TemporaryFolder();

	@Test
	public void lineWithName(){
		Main.NamedNotation input = Main.NamedNotation.parseLine("  CCO   ethyl alcohol ");
		assertEquals("CCO", input.notation);
		assertEquals("ethyl alcohol", input.name);
	}

	@Test
	public void lineWithoutName(){
		Main.NamedNotation input = Main.NamedNotation.parseLine("c1ccccc1");
		assertEquals("c1ccccc1", input.notation);
		assertNull(input.name);
	}

	@Test
	public void blankAndCommentLinesAreSkipped(){
		assertNull(Main.NamedNotation.parseLine("   "));
		assertNull(Main.NamedNotation.parseLine("# header"));
	}

	@Test
	public void readInputsSkipsComments() throws IOException{
		File f = tmpDir.newFile("input.txt");
		Files.write(f.toPath(), Arrays.asList("# notations", "CCO ethanol", "", "CC(=O)O"), StandardCharsets.UTF_8);
		List<Main.NamedNotation> inputs = Main.readInputs(f);
		assertEquals(2, inputs.size());
		assertEquals("ethanol", inputs.get(0).name);
		assertEquals("CC(=O)O", inputs.get(1).notation);
	}

	@Test
	public void parallelConvertKeepsInputOrder(){
		List<Main.NamedNotation> inputs = new ArrayList<>();
		StringBuilder chain = new StringBuilder();
		for(int i=0; i< 20; i++){
			chain.append('C');
			inputs.add(new Main.NamedNotation(chain.toString(), "C" + (i+1)));
		}
		List<MolGraphResult> results = Main.convert(inputs, new MolGraphOptions().addHydrogens(false), 4);
		for(int i=0; i< 20; i++){
			assertEquals(i+1, results.get(i).getMolecule().get().getAtomCount());
			assertEquals("C" + (i+1), results.get(i).getProperties().get().get("Molecule Name"));
		}
	}

	@Test
	public void failedNotationsAreNotWritten() throws IOException{
		List<Main.NamedNotation> inputs = Arrays.asList(
				new Main.NamedNotation("CCO", "ethanol"),
				new Main.NamedNotation("C(C", null),
				new Main.NamedNotation("CC", null));
		List<MolGraphResult> results = Main.convert(inputs, new MolGraphOptions().validate(true), 1);
		assertTrue(results.get(1).hasError());

		List<String> records = new ArrayList<>();
		assertEquals(2, Main.writeSdRecords(inputs, results, records::add));
		assertEquals(2, records.size());
		assertTrue(records.get(0).contains("ethanol"));
		assertTrue(records.get(1).contains(">  <Notation>"));
		assertFalse(records.get(1).contains("Molecule Name"));
	}
}
