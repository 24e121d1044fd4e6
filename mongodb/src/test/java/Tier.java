public enum Tier {
    BRONZE,
    SILVER,
    GOLD
}
