package cascadesim.core;

public interface SimClock {
  long nowMs();

  static SimClock system() {
    return System::currentTimeMillis;
  }
}
