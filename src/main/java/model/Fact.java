package model;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * One observation: function(args) = result.
 */
public class Fact {
    private final Function function;
    private final Object result;
    private final List<Object> args;

    public Fact(Function function, Object result, Object... args) {
        if (args.length != function.getArity()) {
            throw new IllegalArgumentException(function.getName() + " takes " + function.getArity()
                    + " argument(s) but the fact has " + args.length);
        }
        this.function = function;
        this.result = result;
        this.args = Collections.unmodifiableList(Arrays.asList(args.clone()));
    }

    public Function getFunction() {
        return function;
    }

    public Object getResult() {
        return result;
    }

    public List<Object> getArgs() {
        return args;
    }

    public Object getArg(int index) {
        return args.get(index);
    }

    public String asNaturalLanguage() {
        return function.asNaturalLanguage(this);
    }

    @Override
    public String toString() {
        return "Fact(" + function.getName() + " " + args + " -> " + result + ")";
    }
}
