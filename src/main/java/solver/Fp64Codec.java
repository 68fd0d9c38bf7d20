package solver;

import com.microsoft.z3.BitVecNum;
import com.microsoft.z3.Context;
import com.microsoft.z3.Expr;
import com.microsoft.z3.FPExpr;
import com.microsoft.z3.FPNum;
import com.microsoft.z3.enumerations.Z3_decl_kind;

/**
 * Bit-exact conversion between Java doubles and Z3 Float64 numerals.
 * The numeral is built from the IEEE-754 sign, exponent and mantissa fields
 * so no decimal rounding is involved.
 */
public class Fp64Codec {

    public static final int EXPONENT_BITS = 11;
    public static final int MANTISSA_BITS = 52;

    private static final long EXPONENT_MASK = (1L << EXPONENT_BITS) - 1;
    private static final long MANTISSA_MASK = (1L << MANTISSA_BITS) - 1;

    public static BitFields fields(double value) {
        long bits = Double.doubleToRawLongBits(value);
        return new BitFields(
                pad(bits >>> 63, 1),
                pad((bits >>> MANTISSA_BITS) & EXPONENT_MASK, EXPONENT_BITS),
                pad(bits & MANTISSA_MASK, MANTISSA_BITS));
    }

    public static double fromFields(BitFields fields) {
        long bits = (Long.parseLong(fields.getSign(), 2) << 63)
                | (Long.parseLong(fields.getExponent(), 2) << MANTISSA_BITS)
                | Long.parseLong(fields.getMantissa(), 2);
        return Double.longBitsToDouble(bits);
    }

    /**
     * A numeral when the engine folds {@code (fp sign exponent mantissa)};
     * an interrupted context leaves the term as it is, which denotes the
     * same value.
     */
    public static FPExpr encode(Context ctx, double value) {
        long bits = Double.doubleToRawLongBits(value);
        BitVecNum sign = ctx.mkBV(bits >>> 63, 1);
        BitVecNum exponent = ctx.mkBV((bits >>> MANTISSA_BITS) & EXPONENT_MASK, EXPONENT_BITS);
        BitVecNum mantissa = ctx.mkBV(bits & MANTISSA_MASK, MANTISSA_BITS);
        // the Java binding names its 2nd/3rd parameters differently
        FPExpr fields = ctx.mkFP(sign, exponent, mantissa);
        Expr simplified = fields.simplify();
        return simplified instanceof FPNum ? (FPNum) simplified : fields;
    }

    /**
     * True for a Float64 numeral or an {@code (fp ...)} term over bit-vector numerals.
     */
    public static boolean isLiteral(Expr term) {
        return term instanceof FPNum || isFieldTerm(term);
    }

    public static double decode(Expr term) {
        if (term instanceof FPNum) {
            return decodeNumeral((FPNum) term);
        }
        if (isFieldTerm(term)) {
            Expr[] fields = term.getArgs();
            long bits = (((BitVecNum) fields[0]).getLong() << 63)
                    | ((((BitVecNum) fields[1]).getLong() & EXPONENT_MASK) << MANTISSA_BITS)
                    | (((BitVecNum) fields[2]).getLong() & MANTISSA_MASK);
            return Double.longBitsToDouble(bits);
        }
        throw new IllegalArgumentException("Not a floating-point literal: " + term);
    }

    private static boolean isFieldTerm(Expr term) {
        if (!term.isApp() || term.getFuncDecl().getDeclKind() != Z3_decl_kind.Z3_OP_FPA_FP) {
            return false;
        }
        Expr[] fields = term.getArgs();
        return fields.length == 3
                && fields[0] instanceof BitVecNum
                && fields[1] instanceof BitVecNum
                && fields[2] instanceof BitVecNum;
    }

    private static double decodeNumeral(FPNum num) {
        if (num.isNaN()) {
            return Double.NaN;
        }
        boolean negative = num.getSign();
        if (num.isInf()) {
            return negative ? Double.NEGATIVE_INFINITY : Double.POSITIVE_INFINITY;
        }
        if (num.isZero()) {
            return negative ? -0.0 : 0.0;
        }
        long exponent = num.isSubnormal() ? 0 : num.getExponentInt64(true);
        long mantissa = num.getSignificandUInt64();
        long bits = (negative ? 1L << 63 : 0L)
                | ((exponent & EXPONENT_MASK) << MANTISSA_BITS)
                | (mantissa & MANTISSA_MASK);
        return Double.longBitsToDouble(bits);
    }

    private static String pad(long value, int width) {
        StringBuilder sb = new StringBuilder(Long.toBinaryString(value));
        while (sb.length() < width) {
            sb.insert(0, '0');
        }
        return sb.toString();
    }

    public static class BitFields {
        private final String sign;
        private final String exponent;
        private final String mantissa;

        public BitFields(String sign, String exponent, String mantissa) {
            if (sign.length() != 1 || exponent.length() != EXPONENT_BITS || mantissa.length() != MANTISSA_BITS) {
                throw new IllegalArgumentException("Wrong field widths: " + sign + "/" + exponent + "/" + mantissa);
            }
            this.sign = sign;
            this.exponent = exponent;
            this.mantissa = mantissa;
        }

        public String getSign() {
            return sign;
        }

        public String getExponent() {
            return exponent;
        }

        public String getMantissa() {
            return mantissa;
        }

        @Override
        public String toString() {
            return sign + " " + exponent + " " + mantissa;
        }
    }
}
