package gov.nih.ncats.molgraph.internal.parse;

import java.util.Objects;

import gov.nih.ncats.molgraph.InvalidNotationException;

/**
 * Optional front end that rejects notation strings the
 * trusted parse path would resolve into an unspecified graph.
 */
public final class NotationValidator {

    private NotationValidator(){
        //can not instantiate
    }

    /**
     * Check the given notation.
     * @param notation the raw notation; can not be null.
     * @throws InvalidNotationException if the notation is empty, uses characters outside the
     * supported alphabet, has unbalanced or empty branches, an unpaired ring digit,
     * an unsupported ring digit or a bond marker without an atom on both sides.
     * @throws NullPointerException if notation is null.
     */
    public static void validate(String notation){
        Objects.requireNonNull(notation, "notation can not be null");
        String s = NotationNormalizer.collapse(notation);
        if(s.isEmpty()){
            throw new InvalidNotationException(notation, -1, "notation is empty");
        }
        if(!NotationNormalizer.isAtomSymbol(s.charAt(0))){
            throw new InvalidNotationException(notation, 0, "notation must start with an atom");
        }

        int depth=0;
        int[] ringCounts = new int[10];
        for(int i=0; i< s.length(); i++){
            char c = s.charAt(i);
            if(NotationNormalizer.isAtomSymbol(c)){
                continue;
            }
            switch(c){
                case BranchResolver.OPEN:
                    if(i+1 < s.length() && s.charAt(i+1) == BranchResolver.CLOSE){
                        throw new InvalidNotationException(notation, i, "empty branch");
                    }
                    depth++;
                    break;
                case BranchResolver.CLOSE:
                    if(depth==0){
                        throw new InvalidNotationException(notation, i, "unmatched ')'");
                    }
                    depth--;
                    break;
                case BondOrderResolver.DOUBLE_BOND:
                case BondOrderResolver.TRIPLE_BOND:
                    if(i+1 >= s.length() || !NotationNormalizer.isAtomSymbol(s.charAt(i+1))){
                        throw new InvalidNotationException(notation, i, "bond marker '" + c + "' must be followed by an atom");
                    }
                    break;
                default:
                    if(c >= '1' && c <= '9'){
                        if(c > RingClosureResolver.MAX_RING_DIGIT){
                            throw new InvalidNotationException(notation, i, "ring closure digit " + c + " is not supported");
                        }
                        ringCounts[c - '0']++;
                    }else{
                        throw new InvalidNotationException(notation, i, "unsupported character '" + c + "'");
                    }
            }
        }
        if(depth !=0){
            throw new InvalidNotationException(notation, -1, depth + " unclosed branch(es)");
        }
        for(int d=1; d< ringCounts.length; d++){
            if(ringCounts[d] %2 !=0){
                throw new InvalidNotationException(notation, -1, "ring closure digit " + d + " is not paired");
            }
        }
    }
}
