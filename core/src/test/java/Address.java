import io.github.flameyossnowy.recordmapper.api.annotations.DocumentField;

public record Address(
    String street,
    @DocumentField("c") String city,
    @DocumentField("zip") int zipCode
) {}
