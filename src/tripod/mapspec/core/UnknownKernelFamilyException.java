package tripod.mapspec.core;

public class UnknownKernelFamilyException extends IllegalArgumentException {
    private static final long serialVersionUID = 0x2c4f8a1e03d9b76el;

    final String family;

    public UnknownKernelFamilyException (String family) {
        super ("Unknown kernel family \""+family
               +"\"; expecting one of Delta, Gauss, or Hermite");
        this.family = family;
    }

    public String getFamily () { return family; }
}
