package me.christianrobert.camlbuilder.caml.value;

class UserIdValue extends CamlValue {

    UserIdValue() {
        super(CamlValueType.CURRENT_USER, null);
    }

    @Override
    public String getCamlValue() {
        return "<UserID/>";
    }

    @Override
    public String toString() {
        return "UserIdValue{}";
    }
}
