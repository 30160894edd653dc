package gov.nih.ncats.molgraph;

import gov.nih.ncats.common.cli.Cli;
import gov.nih.ncats.common.cli.CliSpecification;
import gov.nih.ncats.common.cli.CliValidationException;
import gov.nih.ncats.common.functions.ThrowableConsumer;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.logging.Level;
import java.util.logging.Logger;

import static gov.nih.ncats.common.cli.CliSpecification.*;

/**
 * Command line interface: convert one notation, or a file of them, into mol/SD files.
 */
public class Main {

    private static final Logger logger = Logger.getLogger(Main.class.getName());

    private static class InputProcessor{
        private int numThreads =1;

        private File inputFile, outputFile;

        public int getNumThreads() {
            return numThreads;
        }

        public void setNumThreads(int numThreads) throws IOException{
            if(numThreads < 1){
                throw new CliValidationException("num of threads must be >=1");
            }
            this.numThreads = numThreads;
        }

        public File getInputFile() {
            return inputFile;
        }

        public void setInputFile(File inputFile) throws IOException{
            if(!inputFile.exists()){
                throw new FileNotFoundException("file '" + inputFile.getAbsolutePath() + "' does not exist");
            }
            this.inputFile = inputFile;
        }

        public File getOutputFile() {
            return outputFile;
        }

        public void setOutputFile(File outputFile) throws IOException {
            File parent = outputFile.getParentFile();
            if(parent !=null){
                Files.createDirectories(parent.toPath());
            }
            this.outputFile = outputFile;
        }
    }

    /**
     * One line of an input file: a notation optionally followed by a name.
     */
    static final class NamedNotation{
        final String notation;
        final String name;

        NamedNotation(String notation, String name){
            this.notation = notation;
            this.name = name;
        }

        /**
         * @return the parsed line or null if the line is blank or a comment.
         */
        static NamedNotation parseLine(String line){
            String trimmed = line.trim();
            if(trimmed.isEmpty() || trimmed.startsWith("#")){
                return null;
            }
            String[] parts = trimmed.split("\\s+", 2);
            return new NamedNotation(parts[0], parts.length > 1 ? parts[1].trim() : null);
        }
    }

    public static void main(String[] args) throws Exception{

        InputProcessor inputProcessor = new InputProcessor();

        CliSpecification spec = CliSpecification.createWithHelp(
                radio(
                        option("s").longName("notation")
                                .argName("string")
                                .description("the line notation of a single molecule to convert. This option or -f is required"),
                        option("f").longName("file")
                                .argName("path")
                                .setToFile(inputProcessor::setInputFile)
                                .description("path to a text file with one notation per line, optionally followed by whitespace and a name. " +
                                        "Blank lines and lines starting with # are skipped. This option or -s is required")
                ),
                option("o").longName("out")
                        .argName("path")
                        .setToFile(inputProcessor::setOutputFile)
                        .description("path of the output file. A mol file for -s, an sd file for -f. If not specified output is sent to STDOUT"),
                option("parallel")
                        .argName("count")
                        .setToInt(inputProcessor::setNumThreads)
                        .addValidation(cli->cli.hasOption("f"), "-parallel only valid with -f")
                        .description("Number of notations to process simultaneously, if not specified defaults to 1"),
                option("noH").isFlag(true)
                        .description("Do not add implicit hydrogens, only output the heavy atoms"),
                option("validate").isFlag(true)
                        .description("Reject malformed notations instead of producing an unspecified structure")
                )
        .programName("molgraph")
        .description("Line notation to molecular graph converter. Parses each notation into atoms and bond orders, " +
                "resolves branches, rings, aromaticity and conjugation and adds implicit hydrogens.")
        .addValidation(cli->cli.hasOption("s") || cli.hasOption("f"),
                "-s or -f option is required")

        .example("-s CC(=O)O", "convert acetic acid and print out the structure mol to STDOUT")
        .example("-s c1ccccc1 -noH -o benzene.mol", "convert benzene without hydrogens and write the mol to benzene.mol")
        .example("-f /path/to/notations.txt -o /path/to/output.sdf", "convert every notation in the file and write a single sd file")
        .example("-f /path/to/notations.txt -parallel 4 -validate", "convert in 4 concurrent threads, rejecting malformed notations, and print the sd records to STDOUT")

                .footer("Developed by NIH/NCATS")
        ;


        if(spec.helpRequested(args)){
            System.out.println(spec.generateUsage());
            return;
        }
        try {
            Cli cli =spec.parse(args);

            MolGraphOptions options = new MolGraphOptions()
                    .addHydrogens(!cli.hasOption("noH"))
                    .validate(cli.hasOption("validate"));

            if(cli.hasOption("s")){
                MolGraphResult result = MolGraph.parse(cli.getOptionValue("s"), options);
                String mol = result.getMolfile().get();
                writeTo(inputProcessor.getOutputFile(), out -> out.println(mol));
            }else{
                List<NamedNotation> inputs = readInputs(inputProcessor.getInputFile());
                if(inputs.isEmpty()){
                    System.out.println("No notations found");
                    return;
                }
                List<MolGraphResult> results = convert(inputs, options, inputProcessor.getNumThreads());
                writeTo(inputProcessor.getOutputFile(), out -> writeSdRecords(inputs, results, out::println));
            }
        }catch(CliValidationException e) {
            System.err.println(e.getMessage());
            System.err.println("\n\n" + spec.generateUsage());
            System.exit(-1);
        }

    }

    static List<NamedNotation> readInputs(File file) throws IOException{
        List<NamedNotation> inputs = new ArrayList<>();
        for(String line : Files.readAllLines(file.toPath(), StandardCharsets.UTF_8)){
            NamedNotation input = NamedNotation.parseLine(line);
            if(input !=null){
                inputs.add(input);
            }
        }
        return inputs;
    }

    static List<MolGraphResult> convert(List<NamedNotation> inputs, MolGraphOptions options, int numThreads){
        if(numThreads ==1){
            //run in serial
            List<MolGraphResult> results = new ArrayList<>(inputs.size());
            for(NamedNotation input : inputs){
                try{
                    results.add(MolGraph.parse(input.notation, options.withName(input.name)));
                }catch(Throwable t){
                    results.add(MolGraphResult.createFromError(t));
                }
            }
            return results;
        }
        ExecutorService executorService = Executors.newFixedThreadPool(numThreads);
        try{
            List<CompletableFuture<MolGraphResult>> futures = new ArrayList<>(inputs.size());
            for(NamedNotation input : inputs){
                futures.add(MolGraph.parseAsync(input.notation, options.withName(input.name), executorService));
            }
            List<MolGraphResult> results = new ArrayList<>(inputs.size());
            for(CompletableFuture<MolGraphResult> f : futures){
                results.add(f.join());
            }
            return results;
        }finally{
            executorService.shutdown();
        }
    }

    /**
     * Write every successful result as an SD record; failures are logged and skipped.
     * @return the number of records written.
     */
    static int writeSdRecords(List<NamedNotation> inputs, List<MolGraphResult> results,
                              ThrowableConsumer<String, IOException> recordConsumer) throws IOException{
        int written=0;
        for(int i=0; i< inputs.size(); i++){
            NamedNotation input = inputs.get(i);
            MolGraphResult result = results.get(i);
            if(result.hasError()){
                logger.log(Level.SEVERE, "error processing notation " + input.notation, result.getError().get());
                continue;
            }
            Map<String, String> props = new LinkedHashMap<>();
            if(input.name !=null){
                props.put("Molecule Name", input.name);
            }
            props.put("Notation", input.notation);
            recordConsumer.accept(result.getSDfile(props).get());
            written++;
        }
        if(written < inputs.size()){
            logger.warning((inputs.size() - written) + " of " + inputs.size() + " notations could not be converted");
        }
        return written;
    }

    private static void writeTo(File outputFile, ThrowableConsumer<PrintWriter, IOException> body) throws IOException{
        if(outputFile ==null){
            PrintWriter writer = new PrintWriter(new OutputStreamWriter(System.out, StandardCharsets.UTF_8));
            body.accept(writer);
            writer.flush();
            return;
        }
        try(PrintWriter writer = new PrintWriter(Files.newBufferedWriter(outputFile.toPath(), StandardCharsets.UTF_8))){
            body.accept(writer);
        }
    }
}
