package util.reflection;

import javax.annotation.Nullable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;


/**
 * A module in which types can be looked up by their binary name, e.g. a named module of the boot layer or the unnamed module of a class loader.
 */
public interface TypeSource {

   static TypeSource of( ClassLoader loader ) {
      return of(loader.getUnnamedModule());
   }

   static TypeSource of( Module module ) {
      return new ModuleTypeSource(module);
   }

   /**
    * @return the type of that name defined in this module, or <code>null</code>, also if it is present but fails to link. Types are not
    *         initialized by the lookup.
    */
   @Nullable
   Class<?> findType( String typeName );

   String getName();


   final class ModuleTypeSource implements TypeSource {

      private static final Logger _log = LoggerFactory.getLogger(ModuleTypeSource.class);

      private final Module _module;

      private ModuleTypeSource( Module module ) {
         _module = module;
      }

      @Override
      public boolean equals( Object o ) {
         return o instanceof ModuleTypeSource other && _module.equals(other._module);
      }

      @Override
      @Nullable
      public Class<?> findType( String typeName ) {
         if ( _module.isNamed() && !_module.getPackages().contains(packageOf(typeName)) ) {
            return null;
         }
         Class<?> type;
         try {
            type = Class.forName(typeName, false, _module.getClassLoader());
         }
         catch ( ClassNotFoundException e ) {
            return null;
         }
         catch ( LinkageError e ) {
            // e.g. a missing superclass, or a name differing only in case on a case-insensitive file system
            _log.debug("type {} cannot be loaded in {}", typeName, this, e);
            return null;
         }
         // reachable by class loader delegation, but defined elsewhere
         return type.getModule() == _module ? type : null;
      }

      public Module getModule() {
         return _module;
      }

      @Override
      public String getName() {
         return _module.isNamed() ? _module.getName() : _module.toString();
      }

      private static String packageOf( String typeName ) {
         int lastDot = typeName.lastIndexOf('.');
         return lastDot < 0 ? "" : typeName.substring(0, lastDot);
      }

      @Override
      public int hashCode() {
         return _module.hashCode();
      }

      @Override
      public String toString() {
         return getName();
      }
   }
}
