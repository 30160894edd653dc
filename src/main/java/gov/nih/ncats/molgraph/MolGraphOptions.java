package gov.nih.ncats.molgraph;

import java.text.NumberFormat;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Collections;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import gov.nih.ncats.molgraph.internal.hydrogen.AtomTyper;
import gov.nih.ncats.molgraph.internal.hydrogen.ValenceAtomTyper;
import gov.nih.ncats.molgraph.internal.util.CachedSupplier;

/**
 * Settings for turning a notation into a {@link MolGraphResult}.
 * Defaults: hydrogens are added with a {@link ValenceAtomTyper}, input is not validated.
 */
public class MolGraphOptions {

    private static final double AROMATIC_TOLERANCE = 1E-6;

    private String name;
    private boolean addHydrogens = true;
    private boolean validate = false;
    private AtomTyper atomTyper = new ValenceAtomTyper();

    public String getName() {
        return name;
    }

    public MolGraphOptions setName(String name){
        this.name = name;
        return this;
    }

    public boolean isAddHydrogens() {
        return addHydrogens;
    }

    public MolGraphOptions addHydrogens(boolean addHydrogens){
        this.addHydrogens = addHydrogens;
        return this;
    }

    public boolean isValidate() {
        return validate;
    }

    /**
     * Check every notation with the validating front end before parsing it.
     * Invalid input then fails with an {@link InvalidNotationException}
     * instead of producing an unspecified graph.
     */
    public MolGraphOptions validate(boolean validate){
        this.validate = validate;
        return this;
    }

    public AtomTyper getAtomTyper() {
        return atomTyper;
    }

    /**
     * Set the atom typer used to classify heavy atoms before hydrogens are added.
     * @param atomTyper the typer; can not be null.
     */
    public MolGraphOptions atomTyper(AtomTyper atomTyper){
        this.atomTyper = Objects.requireNonNull(atomTyper, "atom typer can not be null");
        return this;
    }

    /**
     * A copy of these options with a different name, used when the same
     * options are applied to many named inputs.
     */
    public MolGraphOptions withName(String name){
        return new MolGraphOptions()
                .setName(name)
                .addHydrogens(addHydrogens)
                .validate(validate)
                .atomTyper(atomTyper);
    }

    /**
     * Wrap the given molecule into a result. The result keeps its own copy,
     * so later changes to the given molecule do not show up in it.
     */
    public MolGraphResult computeResult(Molecule molecule){
        Molecule snapshot = Objects.requireNonNull(molecule).copy();
        return new Result(snapshot, name, CachedSupplier.of(()-> toMol(snapshot)));
    }

    private String toMol(Molecule molecule){
        String newLine = System.lineSeparator();
        StringBuilder headerBuilder = new StringBuilder(80);
        if(name !=null){
            headerBuilder.append(name);
        }
        String header = headerBuilder
                .append(newLine)
//		IIPPPPPPPPMMDDYYHHmmddSSssssssssssEEEEEEEEEEEERRRRRR
                .append("  MolGraph")
                //date/time (M/D/Y,H:m)
                .append(MOL_DATETIME_FORMATTER.format(LocalDateTime.now()))
                .append("2D") //no layout, every coordinate is 0
                .append(newLine).append(newLine)
                .toString();

        String countsLine = new StringBuilder(80)
                .append(writeMolInt(molecule.getAtomCount(), 3))
                .append(writeMolInt(molecule.getBondCount(), 3))
                .append("  0  0  0  0  0  0  0  0999 V2000")
                .append(newLine)
                .toString();

        StringBuilder atomBlockBuilder = makeAtomBlock(molecule, newLine);

        StringBuilder bondBuilder = makeBondBlock(molecule, newLine);

        return new StringBuilder(header.length() + countsLine.length() + atomBlockBuilder.length() + bondBuilder.length() + 6)
                .append(header)
                .append(countsLine)
                .append(atomBlockBuilder)
                .append(bondBuilder)
                .append("M  END")
                .toString();
    }

    private StringBuilder makeBondBlock(Molecule molecule, String newLine){
        StringBuilder bondBuilder = new StringBuilder(molecule.getBondCount() *14);
        molecule.forEachBond((i, j, order)->
            bondBuilder.append(writeMolInt(i+1, 3))
                    .append(writeMolInt(j+1, 3))
                    .append(writeMolInt(toMolBondType(order), 3))
                    .append(writeMolInt(0, 3))
                    .append(newLine));
        return bondBuilder;
    }

    /**
     * Fractional orders between single and double are written as aromatic (4),
     * anything else is rounded into 1..3.
     */
    static int toMolBondType(double order){
        long rounded = Math.round(order);
        if(order > 1 + AROMATIC_TOLERANCE && order < 2 - AROMATIC_TOLERANCE){
            return 4;
        }
        if(rounded <1){
            return 1;
        }
        return (int) Math.min(rounded, 3);
    }

    private StringBuilder makeAtomBlock(Molecule molecule, String newLine){
        StringBuilder atomBlockBuilder = new StringBuilder(70* molecule.getAtomCount());
        for(int i=0; i< molecule.getAtomCount(); i++){
            atomBlockBuilder.append(writeMolDouble(0, 10))
                    .append(writeMolDouble(0, 10))
                    .append(writeMolDouble(0, 10))
                    .append(' ')
                    .append(leftPaddWithSpaces(molecule.getElement(i).getSymbol(), 3))
                    .append(writeMolInt(0, 2))
                    .append(writeMolInt(0, 3))
                    .append("  0  0  0  0  0  0  0  0  0  0")
                    .append(newLine);
        }
        return atomBlockBuilder;
    }

    private static String writeMolInt(int value, int numDigits){
        String s = Integer.toString(value);
        if(s.length()>numDigits){
            s="0";
        }
        return rightPaddWithSpaces(s, numDigits);
    }

    private static String writeMolDouble(double d, int width) {
        String value;
        if (Double.isNaN(d) || Double.isInfinite(d)){
            value = "0.0000";
        }else{
            value = MOL_FLOAT_FORMAT.get().format(d);
        }
        return rightPaddWithSpaces(value, width);
    }

    private static String rightPaddWithSpaces(String value, int numDigits) {
        int padd = numDigits - value.length();
        StringBuilder builder = new StringBuilder(numDigits);
        for(int i=0; i< padd; i++){
            builder.append(' ');
        }
        builder.append(value);
        return builder.toString();
    }
    private static String leftPaddWithSpaces(String value, int numDigits) {
        int padd = numDigits - value.length();
        StringBuilder builder = new StringBuilder(numDigits);
        builder.append(value);
        for(int i=0; i< padd; i++){
            builder.append(' ');
        }

        return builder.toString();
    }

    private static final DateTimeFormatter MOL_DATETIME_FORMATTER = DateTimeFormatter.ofPattern("MMddyyHHmm");

    private static final StringBuilder EMPTY_STRING_BUILDER = new StringBuilder();
    private static final ThreadLocal<NumberFormat> MOL_FLOAT_FORMAT = ThreadLocal.withInitial(()->{
        NumberFormat nf = NumberFormat.getNumberInstance(Locale.ENGLISH);
        nf.setMinimumIntegerDigits(1);
        nf.setMaximumIntegerDigits(4);
        nf.setMinimumFractionDigits(4);
        nf.setMaximumFractionDigits(4);
        nf.setGroupingUsed(false);

        return nf;
    });

    private static class Result implements MolGraphResult{
        private final Molecule molecule;
        private final CachedSupplier<String> molSupplier;
        private final String name;

        private static final String lineSep = System.lineSeparator();

        public Result(Molecule molecule, String name, CachedSupplier<String> molSupplier) {
            this.molecule = molecule;
            this.name = name;
            this.molSupplier = molSupplier;
        }

        /**
         * A new copy on every call; the molfile is always written from the untouched snapshot.
         */
        @Override
        public Optional<Molecule> getMolecule() {
            return Optional.of(molecule.copy());
        }

        @Override
        public Optional<String> getMolfile() {
            return Optional.of(molSupplier.get());
        }

        @Override
        public Optional<Map<String, String>> getProperties(){
            if(name!=null){
                return Optional.of(Collections.singletonMap("Molecule Name", name));
            }else{
                return Optional.empty();
            }
        }

        @Override
        public Optional<String> getSDfile(Map<String, String> properties) {
            String mol = molSupplier.get();
            StringBuilder propertiesBuilder = formatProperties(properties);
            StringBuilder sdBuilder = new StringBuilder(mol.length()+propertiesBuilder.length() + 5);
            sdBuilder.append(mol).append(lineSep)
                    .append(propertiesBuilder)
                    .append("$$$$");

            return Optional.of(sdBuilder.toString());
        }

        private StringBuilder formatProperties(Map<String, String> properties){
            if(properties==null || properties.isEmpty()){
                return EMPTY_STRING_BUILDER;
            }

            StringBuilder builder = new StringBuilder(200);
            for(Map.Entry<String, String> entry: properties.entrySet()){
                builder.append(">  <").append(entry.getKey()).append('>').append(lineSep)
                        .append(entry.getValue()).append(lineSep).append(lineSep);
            }
            return builder;
        }

        @Override
        public boolean hasError() {
            return false;
        }

        @Override
        public Optional<Throwable> getError() {
            return Optional.empty();
        }
    }
}
