package cascadesim.config;

import cascadesim.agents.Persona;
import cascadesim.agents.PersonaRole;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

public class PersonaRegistry {
  private final Map<String, Persona> personas;
  private final Map<String, String> nameByNormalized;

  public PersonaRegistry(List<Persona> cast) {
    this.personas = new LinkedHashMap<>();
    this.nameByNormalized = new LinkedHashMap<>();
    for (Persona p : cast) {
      if (personas.putIfAbsent(p.name(), p) != null) {
        throw new IllegalArgumentException("Duplicate persona " + p.name());
      }
      nameByNormalized.put(normalizeName(p.name()), p.name());
    }
  }

  public Collection<Persona> all() { return personas.values(); }
  public List<Persona> asList() { return new ArrayList<>(personas.values()); }
  public Persona byName(String name) { return name == null ? null : personas.get(name); }
  public int size() { return personas.size(); }

  public Persona byNameApprox(String name) {
    if (name == null) return null;
    String normalized = normalizeName(name);
    if (normalized.isEmpty()) return null;
    String exact = nameByNormalized.get(normalized);
    if (exact != null) return personas.get(exact);
    for (var entry : nameByNormalized.entrySet()) {
      if (entry.getKey().startsWith(normalized) || normalized.startsWith(entry.getKey())) {
        return personas.get(entry.getValue());
      }
    }
    return null;
  }

  public Persona firstWithRole(PersonaRole role) {
    for (Persona p : personas.values()) {
      if (p.role() == role) return p;
    }
    return null;
  }

  private static String normalizeName(String name) {
    return name == null ? "" : name.toLowerCase(Locale.ROOT).trim().replaceAll("\\s+", " ");
  }
}
