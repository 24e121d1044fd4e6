import java.util.Date;

public record Event(String name, Date at) {}
