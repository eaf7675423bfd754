package me.christianrobert.camlbuilder.caml.context;

/**
 * Result of a build operation.
 * Contains either the rendered CAML markup or an error message.
 */
public class CamlResult {

    private final boolean success;
    private final String caml;
    private final String errorMessage;
    private final String tree;

    private CamlResult(boolean success, String caml, String errorMessage, String tree) {
        this.success = success;
        this.caml = caml;
        this.errorMessage = errorMessage;
        this.tree = tree;
    }

    /**
     * Creates a successful result.
     */
    public static CamlResult success(String caml) {
        return new CamlResult(true, caml, null, null);
    }

    /**
     * Creates a successful result carrying a formatted outline of the built tree.
     */
    public static CamlResult successWithTree(String caml, String tree) {
        return new CamlResult(true, caml, null, tree);
    }

    /**
     * Creates a failed result.
     */
    public static CamlResult failure(String errorMessage) {
        return new CamlResult(false, null, errorMessage, null);
    }

    /**
     * Creates a failed result from an exception.
     */
    public static CamlResult failure(CamlBuildException exception) {
        return new CamlResult(false, null, exception.getDetailedMessage(), null);
    }

    public boolean isSuccess() {
        return success;
    }

    public boolean isFailure() {
        return !success;
    }

    public String getCaml() {
        return caml;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public String getTree() {
        return tree;
    }

    public boolean hasTree() {
        return tree != null;
    }

    @Override
    public String toString() {
        if (success) {
            return "CamlResult{success=true, caml='" + caml + "'}";
        } else {
            return "CamlResult{success=false, error='" + errorMessage + "'}";
        }
    }
}
