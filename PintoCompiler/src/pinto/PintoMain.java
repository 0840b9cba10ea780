package pinto;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Optional;

import com.google.common.collect.ImmutableList;
import com.google.common.io.Files;

import pinto.canvas.Shape;
import pinto.canvas.SnapshotCodec;

public class PintoMain {

  private static final String USAGE =
      "Usage: $PINTO compile in.pinto out.json [algorithm] [direction]\n"
          + "       $PINTO decompile in.json out.pinto";

  public static void main(String[] args) throws IOException {
    if (args.length < 3) {
      usage();
    }

    boolean success;
    switch (args[0]) {
      case "compile":
        success = compile(args);
        break;
      case "decompile":
        success = decompile(args);
        break;
      default:
        usage();
        return;
    }

    if (!success) {
      System.out.println("Failed.  See errors above.");
      System.exit(1);
    }
  }

  private static boolean compile(String[] args) throws IOException {
    if (args.length > 5) {
      usage();
    }

    CompileOptions.Builder options = CompileOptions.builder();
    if (args.length > 3) {
      Optional<CompileOptions.Algorithm> algorithm = CompileOptions.Algorithm.parse(args[3]);
      if (!algorithm.isPresent()) {
        System.err.println("Unknown layout algorithm: " + args[3]);
        return false;
      }
      options.setAlgorithm(algorithm.get());
    }
    if (args.length > 4) {
      Optional<CompileOptions.Direction> direction = CompileOptions.Direction.parse(args[4]);
      if (!direction.isPresent()) {
        System.err.println("Unknown layout direction: " + args[4]);
        return false;
      }
      options.setDirection(direction.get());
    }

    String in = args[1];
    CompileResult result;
    try {
      result =
          new LayoutCompiler(new ElkLayoutEngine()).parseAndCompile(read(in), options.build());
    } catch (LayoutException ex) {
      ex.print(in);
      return false;
    }
    if (result.hasErrors()) {
      result.errors().stream().map(ParseError::toException).forEach(ex -> ex.print(in));
      return false;
    }

    write(SnapshotCodec.write(result.shapes()), args[2]);
    System.out.println(
        String.format("Compiled %d shapes into %s", result.shapes().size(), args[2]));
    return true;
  }

  private static boolean decompile(String[] args) throws IOException {
    if (args.length != 3) {
      usage();
    }

    ImmutableList<Shape> shapes;
    try {
      shapes = SnapshotCodec.read(read(args[1]));
    } catch (IOException ex) {
      new CompilerException("unreadable snapshot: " + ex.getMessage(), ex).print(args[1]);
      return false;
    }

    write(Decompiler.decompile(shapes), args[2]);
    System.out.println(String.format("Decompiled %d shapes into %s", shapes.size(), args[2]));
    return true;
  }

  private static void usage() {
    System.err.println(USAGE);
    System.exit(1);
  }

  private static String read(String file) throws IOException {
    return Files.asCharSource(new File(file), StandardCharsets.UTF_8).read();
  }

  private static void write(String string, String file) throws IOException {
    Files.asCharSink(new File(file), StandardCharsets.UTF_8).write(string);
  }
}
