package model;

public class Units {
    private final String singular;
    private final String plural;

    public Units(String singular, String plural) {
        this.singular = singular;
        this.plural = plural;
    }

    public String getSingular() {
        return singular;
    }

    public String getPlural() {
        return plural;
    }

    public boolean isEpochalDay() {
        return singular.toLowerCase().contains("epochal day");
    }

    public String format(Object value) {
        if (value instanceof Number) {
            return value + " " + (((Number) value).doubleValue() == 1 ? singular : plural);
        }
        return value + " " + singular;
    }

    @Override
    public String toString() {
        return "(" + singular + ", " + plural + ")";
    }
}
