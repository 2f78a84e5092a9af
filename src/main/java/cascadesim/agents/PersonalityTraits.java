package cascadesim.agents;

import cascadesim.core.Lottery;

public record PersonalityTraits(double openness,
                                double conscientiousness,
                                double extraversion,
                                double agreeableness,
                                double neuroticism) {
  public PersonalityTraits {
    openness = Lottery.clamp01(openness);
    conscientiousness = Lottery.clamp01(conscientiousness);
    extraversion = Lottery.clamp01(extraversion);
    agreeableness = Lottery.clamp01(agreeableness);
    neuroticism = Lottery.clamp01(neuroticism);
  }
}
