import io.github.flameyossnowy.recordmapper.api.annotations.DefaultValue;
import io.github.flameyossnowy.recordmapper.api.annotations.DocumentField;

import java.util.List;
import java.util.Map;
import java.util.Optional;

public record Customer(
    @DocumentField("n") String name,
    int age,
    Address address,
    Optional<Address> billing,
    Optional<String> nickname,
    List<String> tags,
    Map<String, Integer> scores,
    Optional<List<Skill>> skills,
    @DefaultValue("BRONZE") Tier tier
) {}
