package de.julielab.jules.ae.placemapping.knowledge;

/**
 * A place name that is also frequently used as a personal name, e.g.
 * <tt>柏</tt>.
 */
public class AmbiguousName {
    private final String name;
    private final double personLikelihood;
    private final String modernPlace;

    public AmbiguousName(String name, double personLikelihood, String modernPlace) {
        this.name = name;
        this.personLikelihood = personLikelihood;
        this.modernPlace = modernPlace;
    }

    public String getName() {
        return name;
    }

    public double getPersonLikelihood() {
        return personLikelihood;
    }

    /**
     * @return the modern place the name most likely refers to when it is used as
     * a place name, used as a region hint for geocoding
     */
    public String getModernPlace() {
        return modernPlace;
    }

    @Override
    public String toString() {
        return "AmbiguousName [name=" + name + ", personLikelihood=" + personLikelihood + ", modernPlace=" + modernPlace + "]";
    }
}
