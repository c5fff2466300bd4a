package hipify.common;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.junit.jupiter.api.Assertions.*;

public class ScratchFileTest
{
  @Test
  void scratchNameReplacesTrailingSuffixOnly()
  {
    assertEquals("dir.cu/kernel.hip.cu", ScratchFile.scratchName("dir.cu/kernel.cu"));
    assertEquals("a.cu.hip.cu", ScratchFile.scratchName("a.cu.cu"));
    assertNull(ScratchFile.scratchName("kernel.cpp"));
    assertNull(ScratchFile.scratchName("kernel.cuh"));
  }

  @Test
  void cudaSourceIsCopiedAndRenamedBack(@TempDir Path dir) throws Exception
  {
    Path original = dir.resolve("vec.cu");
    Files.write(original, "int x;\n".getBytes(StandardCharsets.UTF_8));

    ScratchFile scratch = ScratchFile.prepare(original.toString());
    Path working = dir.resolve("vec.hip.cu");
    assertTrue(scratch.isCopy());
    assertEquals(working.toString(), scratch.getWorkingPath());
    assertTrue(Files.exists(working));

    Files.write(working, "int y;\n".getBytes(StandardCharsets.UTF_8));
    scratch.commit();

    assertFalse(Files.exists(working));
    assertEquals("int y;\n", new String(Files.readAllBytes(original), StandardCharsets.UTF_8));
  }

  @Test
  void discardLeavesOriginalUntouched(@TempDir Path dir) throws Exception
  {
    Path original = dir.resolve("vec.cu");
    Files.write(original, "int x;\n".getBytes(StandardCharsets.UTF_8));

    ScratchFile scratch = ScratchFile.prepare(original.toString());
    scratch.discard();

    assertFalse(Files.exists(dir.resolve("vec.hip.cu")));
    assertEquals("int x;\n", new String(Files.readAllBytes(original), StandardCharsets.UTF_8));
  }

  @Test
  void otherSourcesAreWorkedOnInPlace(@TempDir Path dir) throws Exception
  {
    Path original = dir.resolve("host.cpp");
    Files.write(original, "int x;\n".getBytes(StandardCharsets.UTF_8));

    ScratchFile scratch = ScratchFile.prepare(original.toString());

    assertFalse(scratch.isCopy());
    assertEquals(original.toString(), scratch.getWorkingPath());
    scratch.commit();
    assertTrue(Files.exists(original));
  }

  @Test
  void missingSourceFails(@TempDir Path dir)
  {
    assertThrows(java.io.FileNotFoundException.class,
        () -> ScratchFile.prepare(dir.resolve("none.cu").toString()));
  }
}
