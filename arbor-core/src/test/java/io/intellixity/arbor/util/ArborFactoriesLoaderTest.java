package io.intellixity.arbor.util;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class ArborFactoriesLoaderTest {
  public interface Greeter {
    String greet();
  }

  public static final class Hello implements Greeter {
    @Override
    public String greet() { return "hello"; }
  }

  public static final class Hola implements Greeter {
    @Override
    public String greet() { return "hola"; }
  }

  public interface Broken {}

  public interface Unregistered {}

  @Test
  void loadsRegisteredImplementationsOnceInDeclarationOrder() {
    List<Greeter> greeters = ArborFactoriesLoader.load(Greeter.class);
    assertEquals(List.of("hello", "hola"), greeters.stream().map(Greeter::greet).toList());
  }

  @Test
  void unregisteredTypeYieldsNothing() {
    assertTrue(ArborFactoriesLoader.load(Unregistered.class).isEmpty());
  }

  @Test
  void rejectsImplementationOfWrongType() {
    assertThrows(IllegalArgumentException.class, () -> ArborFactoriesLoader.load(Broken.class));
  }
}
