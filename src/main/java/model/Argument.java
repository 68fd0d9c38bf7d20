package model;

public class Argument {
    private final String name;
    private final ValueSort sort;

    public Argument(String name, ValueSort sort) {
        this.name = name;
        this.sort = sort;
    }

    public String getName() {
        return name;
    }

    public ValueSort getSort() {
        return sort;
    }

    @Override
    public String toString() {
        return "(" + name + ", " + sort + ")";
    }
}
