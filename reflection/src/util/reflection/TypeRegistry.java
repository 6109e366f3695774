package util.reflection;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import javax.annotation.Nullable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.ImmutableList;

import util.reflection.Reflection.AmbiguousTypeNameException;
import util.reflection.Reflection.NotFoundException;


/**
 * Immutable snapshot of the {@link TypeSource}s searched when looking up a type by name without naming its module.
 */
public final class TypeRegistry {

   private static final Logger _log = LoggerFactory.getLogger(TypeRegistry.class);

   /**
    * Snapshot of the modules loaded right now: all modules of the boot layer, plus the unnamed modules of the system class loader, the current thread's
    * context class loader and the class loader of this library.
    */
   public static TypeRegistry current() {
      Set<Module> modules = new LinkedHashSet<>(ModuleLayer.boot().modules());
      addUnnamedModule(modules, ClassLoader.getSystemClassLoader());
      addUnnamedModule(modules, Thread.currentThread().getContextClassLoader());
      addUnnamedModule(modules, TypeRegistry.class.getClassLoader());

      ImmutableList.Builder<TypeSource> sources = ImmutableList.builder();
      for ( Module module : modules ) {
         sources.add(TypeSource.of(module));
      }
      return new TypeRegistry(sources.build());
   }

   public static TypeRegistry of( TypeSource... sources ) {
      return new TypeRegistry(ImmutableList.copyOf(sources));
   }

   public static TypeRegistry of( Iterable<? extends TypeSource> sources ) {
      return new TypeRegistry(ImmutableList.copyOf(sources));
   }

   private static void addUnnamedModule( Set<Module> modules, @Nullable ClassLoader loader ) {
      if ( loader != null ) {
         modules.add(loader.getUnnamedModule());
      }
   }

   private final ImmutableList<TypeSource> _sources;

   private TypeRegistry( ImmutableList<TypeSource> sources ) {
      _sources = sources;
   }

   /**
    * @throws NotFoundException if none of the sources defines a type of that name
    * @throws AmbiguousTypeNameException if more than one source defines a type of that name
    */
   public Class<?> getExpectedType( String typeName ) {
      Class<?> foundType = null;
      TypeSource foundIn = null;
      for ( TypeSource source : _sources ) {
         Class<?> type = source.findType(typeName);
         if ( type != null ) {
            if ( foundType != null ) {
               _log.debug("type {} found in {} and {}", typeName, foundIn, source);
               throw new AmbiguousTypeNameException("More than one type named '" + typeName + "' in loaded modules.");
            }
            foundType = type;
            foundIn = source;
         }
      }
      if ( foundType == null ) {
         throw new NotFoundException("Type '" + typeName + "' not found in any loaded module.");
      }
      _log.debug("type {} found in {}", typeName, foundIn);
      return foundType;
   }

   public List<TypeSource> getSources() {
      return _sources;
   }

   @Override
   public String toString() {
      return "TypeRegistry" + _sources;
   }
}
