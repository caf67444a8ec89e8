package com.dbc.contracts;

/**
 * A call left a required parameter unbound.
 */
public class MissingArgumentException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    private final String function;
    private final String parameter;

    public MissingArgumentException(String function, String parameter) {
        super(function + " missing required argument: '" + parameter + "'");
        this.function = function;
        this.parameter = parameter;
    }

    public String getFunction() {
        return function;
    }

    public String getParameter() {
        return parameter;
    }
}
