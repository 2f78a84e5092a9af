package cascadesim.agents;

import java.util.List;

public class PersonaProfile {
  public final PersonaRole role;
  public final double speakerBias;   // multiplier in the speaker lottery
  public final List<String> phobias; // words that frighten this persona

  public PersonaProfile(PersonaRole role, double speakerBias, List<String> phobias) {
    this.role = role == null ? PersonaRole.SUPPORTING : role;
    this.speakerBias = speakerBias > 0 ? speakerBias : 1.0;
    this.phobias = phobias == null ? List.of() : List.copyOf(phobias);
  }

  public boolean isLead() {
    return role == PersonaRole.LEAD;
  }
}
