package gov.nih.ncats.molgraph;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.stream.Collectors;

import gov.nih.ncats.molgraph.internal.hydrogen.AtomTyper;
import gov.nih.ncats.molgraph.internal.hydrogen.HydrogenCompleter;
import gov.nih.ncats.molgraph.internal.parse.NotationParser;
import gov.nih.ncats.molgraph.internal.parse.NotationValidator;

/**
 * Entry point for converting line-notation strings into molecular graphs.
 */
public final class MolGraph {

	private static final MolGraphOptions DEFAULT_OPTIONS = new MolGraphOptions();

	private MolGraph(){
		//can not instantiate
	}

	/**
	 * Parse the given notation into a molecular graph including its implicit hydrogens.
	 * @param notation the notation to parse, can not be null.
	 * @return a new {@link Molecule}.
	 * @throws NullPointerException if notation is null.
	 */
	public static Molecule parse(String notation){
		return resolve(notation, DEFAULT_OPTIONS);
	}

	/**
	 * Parse the given notation and compute a {@link MolGraphResult} using the given {@link MolGraphOptions}.
	 *
	 * @param notation the notation to parse, can not be null.
	 * @param options the {@link MolGraphOptions} to use; if options is null, then the default options are used.
	 *
	 * @return a {@link MolGraphResult} holding the molecule.
	 * @throws NullPointerException if notation is null.
	 * @throws InvalidNotationException if the options ask for validation and the notation is invalid.
	 */
	public static MolGraphResult parse(String notation, MolGraphOptions options){
		options = Optional.ofNullable(options).orElse(DEFAULT_OPTIONS);
		return options.computeResult(resolve(notation, options));
	}

	/**
	 * Parse the given notation into its heavy-atom graph, without hydrogens.
	 * @param notation the notation to parse, can not be null.
	 * @return a new {@link Molecule}.
	 */
	public static Molecule parseHeavyAtoms(String notation){
		checkNotNull(notation);
		return NotationParser.parse(notation);
	}

	/**
	 * Add the implicit hydrogens to a heavy-atom graph.
	 * @param heavyAtoms the graph; not modified.
	 * @param typer the atom typer to classify the heavy atoms with.
	 * @return a new {@link Molecule} with the hydrogens appended after the heavy atoms.
	 */
	public static Molecule addHydrogens(Molecule heavyAtoms, AtomTyper typer){
		return HydrogenCompleter.complete(heavyAtoms, typer);
	}

	/**
	 * Parse every notation in order.  A notation that fails does not stop the batch,
	 * its result {@link MolGraphResult#hasError() has an error} instead.
	 *
	 * @param notations the notations to parse, can not be null.
	 * @param options the options to use for each; if null the default options are used.
	 * @return one result per notation in the same order.
	 */
	public static List<MolGraphResult> parseAll(List<String> notations, MolGraphOptions options){
		Objects.requireNonNull(notations, "notations can not be null");
		List<MolGraphResult> results = new ArrayList<>(notations.size());
		for(String notation : notations){
			try{
				results.add(parse(notation, options));
			}catch(RuntimeException e){
				results.add(MolGraphResult.createFromError(e));
			}
		}
		return results;
	}

	/**
	 * Parse every notation on the given executor; each notation gets its own Molecule.
	 * @return one result per notation in the same order.
	 */
	public static List<MolGraphResult> parseAll(List<String> notations, MolGraphOptions options, Executor executor){
		Objects.requireNonNull(notations, "notations can not be null");
		List<CompletableFuture<MolGraphResult>> futures = notations.stream()
				.map(n-> parseAsync(n, options, executor))
				.collect(Collectors.toList());
		return futures.stream()
				.map(CompletableFuture::join)
				.collect(Collectors.toList());
	}

	public static CompletableFuture<MolGraphResult> parseAsync(String notation, MolGraphOptions options){
		return CompletableFuture.supplyAsync(() -> {
			try{
				return parse(notation, options);
			}catch(Exception e){
				return MolGraphResult.createFromError(e);
			}
		});
	}

	public static CompletableFuture<MolGraphResult> parseAsync(String notation, MolGraphOptions options, Executor executor){
		return CompletableFuture.supplyAsync(() -> {
			try{
				return parse(notation, options);
			}catch(Exception e){
				return MolGraphResult.createFromError(e);
			}
		},executor);
	}

	private static Molecule resolve(String notation, MolGraphOptions options){
		checkNotNull(notation);
		if(options.isValidate()){
			NotationValidator.validate(notation);
		}
		Molecule heavy = NotationParser.parse(notation);
		if(!options.isAddHydrogens()){
			return heavy;
		}
		return HydrogenCompleter.complete(heavy, options.getAtomTyper());
	}

	private static void checkNotNull(Object obj){
		Objects.requireNonNull(obj, "notation can not be null");
	}
}
